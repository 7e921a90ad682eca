package io.coldtag.core.result;

/// Classification of a failed evaluation.
///
/// Every error is reported through a {@link FunctionResult}; none of them is fatal and none
/// is thrown past the evaluation boundary.
public enum ErrorCode {

    /// A required input role is absent from the config (no location tag, no time tag, ...).
    MISSING_INPUT,

    /// A referenced tag id does not exist in the roster.
    TAG_NOT_FOUND,

    /// A tag value could not be parsed as the required type (date, number).
    INVALID_VALUE,

    /// A single-value role resolved to more than one distinct value.
    MULTIPLE_VALUES_NOT_ALLOWED,

    /// Start/end unparseable, start after end, or a non-positive duration.
    INVALID_INTERVAL,

    /// The query window and location set matched zero readings.
    NO_DATA,

    /// Data existed but no reading satisfied the function's predicate.
    NO_MATCH,

    /// A derived denominator is zero or non-finite.
    INVALID_COMPUTATION,

    /// The function kind identifier is outside the registered catalogue.
    UNKNOWN_FUNCTION_KIND,

    /// The reading store failed to answer the query.
    DATA_SOURCE_FAILURE,

    /// An algorithm failed with an unexpected runtime exception.
    INTERNAL_ERROR
}
