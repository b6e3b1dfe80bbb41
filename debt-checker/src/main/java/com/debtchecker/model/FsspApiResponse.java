package com.debtchecker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the api-cloud.ru FSSP JSON structure.
 * Kept separate from the outcome model to isolate API coupling.
 *
 * Success:  {"status":200,"count":1,"records":[{"sum":"1520.75", ...}]}
 * Failure:  {"error":"602","message":"..."}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FsspApiResponse {

    /** Error code as a string, e.g. "602" (no access) or "498" (no money on the token). */
    private String error;

    private String message;

    private Integer status;

    private Integer count;

    private List<Record> records;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Record {
        /** Outstanding amount; the API sends it as a string or a number. */
        private String sum;
    }
}
