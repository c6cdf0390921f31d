package com.arbiter.exception;

import com.arbiter.domain.enums.ExecutionReportType;
import com.arbiter.domain.enums.PositionState;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * A lifecycle transition outside the legal table, or one triggered by a mandate that is not
 * admissible in the current state. Terminal for the position: the ledger moves it to FAILED.
 */
@Getter
public class IllegalTransitionException extends BaseException {

    private final String symbol;
    private final PositionState from;
    private final ExecutionReportType reportType;

    public IllegalTransitionException(String symbol, PositionState from, ExecutionReportType reportType, String message) {
        super(ErrorCode.ILLEGAL_TRANSITION, message, details(symbol, from, reportType));
        this.symbol = symbol;
        this.from = from;
        this.reportType = reportType;
    }

    private static Map<String, Object> details(String symbol, PositionState from, ExecutionReportType reportType) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", symbol);
        details.put("from", from != null ? from.name() : "N/A");
        details.put("report", reportType != null ? reportType.name() : "N/A");
        return details;
    }
}
