package com.brandinsight.research.exception;

/**
 * 외부 커넥터(검색, 텍스트 생성, 스크래퍼, 서브프로세스) 호출 실패.
 * 어떤 커넥터가 실패했는지 connector 이름을 함께 전달합니다.
 */
public class ProviderException extends RuntimeException {

    private final String errorCode;
    private final String connector;

    public ProviderException(String connector, String message) {
        super(message);
        this.errorCode = "PROVIDER_ERROR";
        this.connector = connector;
    }

    public ProviderException(String connector, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "PROVIDER_ERROR";
        this.connector = connector;
    }

    public ProviderException(String errorCode, String connector, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.connector = connector;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getConnector() {
        return connector;
    }
}
