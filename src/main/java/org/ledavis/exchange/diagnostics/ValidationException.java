package org.ledavis.exchange.diagnostics;

/**
 * 交换文件校验失败（语法错误或实例重名）。
 * <p>
 * 与环境类错误（文件不存在、读取失败等）区分开：后者使用 {@link IllegalArgumentException}/
 * {@link IllegalStateException}，不属于这一体系。任一校验失败都会终止本次解析，不返回部分模型。
 */
public abstract class ValidationException extends RuntimeException {

    protected ValidationException(String message) {
        super(message);
    }

    /**
     * 结构化诊断记录；{@code withMessage=false} 时不包含格式化文本。
     */
    public abstract Diagnostic toDiagnostic(boolean withMessage);

    public Diagnostic toDiagnostic() {
        return toDiagnostic(true);
    }

    public abstract int lineNumber();
}
