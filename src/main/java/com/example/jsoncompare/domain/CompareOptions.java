package com.example.jsoncompare.domain;

/**
 * Comparison policies applied by the diff engine.
 *
 * @param ignoreKeyOrder diff object members in sorted key order instead of left-document order
 * @param ignoreArrayOrder match array elements by content or identity instead of by position
 * @param strictType when false, primitives of different types are equal if their text renderings match
 */
public record CompareOptions(boolean ignoreKeyOrder, boolean ignoreArrayOrder, boolean strictType) {

    public static CompareOptions defaults() {
        return new CompareOptions(true, false, true);
    }

    public CompareOptions withIgnoreKeyOrder(boolean value) {
        return new CompareOptions(value, ignoreArrayOrder, strictType);
    }

    public CompareOptions withIgnoreArrayOrder(boolean value) {
        return new CompareOptions(ignoreKeyOrder, value, strictType);
    }

    public CompareOptions withStrictType(boolean value) {
        return new CompareOptions(ignoreKeyOrder, ignoreArrayOrder, value);
    }
}
