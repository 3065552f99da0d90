package com.example.jsoncompare.web;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Set;

/**
 * Body of the compare endpoints. Unset switches fall back to the configured defaults.
 */
@Getter
@Setter
@NoArgsConstructor
public class CompareRequest {
    private String left;
    private String right;
    private Boolean ignoreKeyOrder;
    private Boolean ignoreArrayOrder;
    private Boolean strictType;
    private Set<Integer> expandedSections;
    private Integer indentWidth;
}
