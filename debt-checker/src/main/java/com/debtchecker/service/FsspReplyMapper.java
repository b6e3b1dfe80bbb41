package com.debtchecker.service;

import com.debtchecker.model.ApiReply;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.FsspApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Maps a parsed FSSP API body to a classified {@link ApiReply}.
 *
 * Error codes seen in the wild:
 *  - 602: token has no access to the method (fatal)
 *  - 498: token balance is empty (fatal)
 * Other codes are treated like HTTP statuses of the same number.
 */
@Component
@Slf4j
public class FsspReplyMapper {

    static final String ERROR_NO_ACCESS = "602";
    static final String ERROR_NO_MONEY = "498";

    public ApiReply map(FsspApiResponse body, String identifier) {
        if (body == null) {
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "empty response body");
        }

        if (body.getError() != null && !body.getError().isBlank()) {
            return mapError(body.getError().trim(), body.getMessage());
        }

        Integer status = body.getStatus();
        if (status == null || status != 200) {
            log.warn("Non-200 status for {}: {}", identifier, status);
            return ApiReply.error(classifyStatus(status == null ? -1 : status), "response status " + status);
        }

        Integer count = body.getCount();
        if (count == null) {
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "response has no count");
        }
        if (count == 0) {
            return ApiReply.notFound();
        }
        return singleRecord(body.getRecords(), count, identifier);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ApiReply mapError(String code, String message) {
        if (ERROR_NO_ACCESS.equals(code)) {
            return ApiReply.error(ErrorKind.AUTH_REJECTED, message);
        }
        if (ERROR_NO_MONEY.equals(code)) {
            return ApiReply.error(ErrorKind.BALANCE_EXHAUSTED, message);
        }
        int numeric;
        try {
            numeric = Integer.parseInt(code);
        } catch (NumberFormatException e) {
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "error " + code + ": " + message);
        }
        return ApiReply.error(classifyStatus(numeric), "error " + code + ": " + message);
    }

    /**
     * One enforcement procedure maps to exactly one record. Any other count is
     * an answer we cannot price, so it fails the lookup.
     */
    private ApiReply singleRecord(List<FsspApiResponse.Record> records, int count, String identifier) {
        if (count != 1 || records == null || records.size() != 1) {
            log.warn("Unexpected record count for {}: count={}, records={}",
                    identifier, count, records == null ? 0 : records.size());
            return ApiReply.error(ErrorKind.INVALID_RESPONSE,
                    "count " + count + " with " + (records == null ? 0 : records.size()) + " records");
        }
        FsspApiResponse.Record record = records.get(0);
        BigDecimal amount = parseAmount(record == null ? null : record.getSum());
        if (amount == null) {
            log.error("Data parsing failed for {}: sum={}", identifier, record == null ? null : record.getSum());
            return ApiReply.error(ErrorKind.INVALID_RESPONSE, "unparseable sum");
        }
        return ApiReply.found(amount);
    }

    static ErrorKind classifyStatus(int status) {
        if (status == 429) return ErrorKind.RATE_LIMITED;
        if (status >= 500) return ErrorKind.SERVER_ERROR;
        if (status == 401 || status == 403) return ErrorKind.AUTH_REJECTED;
        if (status == 402) return ErrorKind.BALANCE_EXHAUSTED;
        if (status == 400 || status == 422) return ErrorKind.MALFORMED_IDENTIFIER;
        return ErrorKind.INVALID_RESPONSE;
    }

    static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String normalised = raw.trim().replace("\u00A0", "").replace(" ", "").replace(',', '.');
        try {
            return new BigDecimal(normalised);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
