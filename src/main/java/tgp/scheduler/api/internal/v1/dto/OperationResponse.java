package tgp.scheduler.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tgp.scheduler.model.ReportResult;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") ReportResult result,
        @JsonProperty("error") String error) {

    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    public static OperationResponse of(ReportResult result) {
        boolean ok = result == ReportResult.APPLIED || result == ReportResult.ALREADY_TERMINAL;
        return new OperationResponse(ok, result, null);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, null, error);
    }
}
