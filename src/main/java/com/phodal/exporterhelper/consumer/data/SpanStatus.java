package com.phodal.exporterhelper.consumer.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Legacy span status: a numeric canonical code plus an optional message.
 * Code {@code 0} means OK.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpanStatus {

    public static final int CODE_OK = 0;
    public static final int CODE_UNKNOWN = 2;

    private int code;
    private String message;

    public boolean isOk() {
        return code == CODE_OK;
    }

    public static SpanStatus ok() {
        return SpanStatus.builder()
                .code(CODE_OK)
                .build();
    }

    public static SpanStatus error(int code, String message) {
        return SpanStatus.builder()
                .code(code)
                .message(message)
                .build();
    }
}
