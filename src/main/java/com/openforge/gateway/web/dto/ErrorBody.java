package com.openforge.gateway.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** JSON error payload returned by every endpoint. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorBody(String error, String type, List<String> details) {

    public static ErrorBody of(String error, String type) {
        return new ErrorBody(error, type, List.of());
    }
}
