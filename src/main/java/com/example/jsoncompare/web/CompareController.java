package com.example.jsoncompare.web;

import com.example.jsoncompare.application.ComparisonUseCase;
import com.example.jsoncompare.domain.DiffEntry;
import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonComparisonRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/compare")
public class CompareController {
    private static final Logger log = LogManager.getLogger(CompareController.class);

    private final ComparisonUseCase comparisonUseCase;
    private final CompareRequestAdapter requestAdapter;

    public CompareController(ComparisonUseCase comparisonUseCase, CompareRequestAdapter requestAdapter) {
        this.comparisonUseCase = comparisonUseCase;
        this.requestAdapter = requestAdapter;
    }

    @PostMapping
    public CompareResponse compare(@RequestBody CompareRequest body) {
        JsonComparisonRequest request = adapt(body);
        try {
            return CompareResponse.from(comparisonUseCase.compare(request));
        } catch (InvalidJsonException ex) {
            throw badJson(ex);
        }
    }

    @PostMapping("/diff")
    public List<DiffEntry> copyDiff(@RequestBody CompareRequest body) {
        JsonComparisonRequest request = adapt(body);
        try {
            return comparisonUseCase.serializeDiff(
                    request.leftText(), request.rightText(), request.options());
        } catch (InvalidJsonException ex) {
            throw badJson(ex);
        }
    }

    private JsonComparisonRequest adapt(CompareRequest body) {
        try {
            return requestAdapter.adapt(body, comparisonUseCase.defaultOptions());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    private ResponseStatusException badJson(InvalidJsonException ex) {
        String side = ex.getSide() == null ? "input" : ex.getSide().name().toLowerCase(Locale.ROOT);
        log.warn("Rejected comparison: {} document is not valid JSON", side);
        return new ResponseStatusException(
                HttpStatus.BAD_REQUEST, "The " + side + " document is not valid JSON: " + ex.getMessage(), ex);
    }
}
