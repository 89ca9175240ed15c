package tw.gc.quant.backtest.exceptions;

/**
 * Exception for backtest-specific errors.
 * Carries a structured error code so callers can tell a rejected run from a failed one.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_CONFIGURATION,
        PROVIDER_TIMEOUT,
        SIMULATION_ERROR,
        NO_SUCCESSFUL_TRIALS,
        INTERRUPTED
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
