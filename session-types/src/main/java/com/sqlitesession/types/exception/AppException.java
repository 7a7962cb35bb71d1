package com.sqlitesession.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一处理会话存储中的异常，包含异常码和异常描述信息。
 * 存储层的重复、缺失与底层失败均通过其子类抛出，便于调用方按异常码或类型区分。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    /**
     * 将异常转换为字符串表示。
     *
     * @return 包含异常码和描述信息的字符串
     */
    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
