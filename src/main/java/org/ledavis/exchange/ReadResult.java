package org.ledavis.exchange;

import org.ledavis.exchange.diagnostics.Diagnostic;
import org.ledavis.exchange.diagnostics.ValidationException;
import org.ledavis.exchange.model.ExchangeModel;

/**
 * 一次读取的结果：要么是完整模型，要么是第一个校验错误（不会同时存在，也不会有部分模型）。
 */
public record ReadResult(ExchangeModel model, ValidationException error) {

    public ReadResult {
        if ((model == null) == (error == null)) {
            throw new IllegalArgumentException("model 与 error 必须且只能有一个非空");
        }
    }

    public static ReadResult valid(ExchangeModel model) {
        return new ReadResult(model, null);
    }

    public static ReadResult invalid(ValidationException error) {
        return new ReadResult(null, error);
    }

    public boolean isValid() {
        return model != null;
    }

    public Diagnostic diagnostic() {
        return (error == null) ? null : error.toDiagnostic();
    }
}
