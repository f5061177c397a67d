package com.questrail.spex.convert;

import com.questrail.spex.model.ResponseMatrix;

import java.util.Objects;

/**
 * A converted response matrix and whether its channel order was reversed.
 */
public record ConvertedResponse(ResponseMatrix response, boolean swapped)
{
    public ConvertedResponse {
        Objects.requireNonNull(response, "response");
    }
}
