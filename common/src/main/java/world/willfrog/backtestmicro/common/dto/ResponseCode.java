package world.willfrog.backtestmicro.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 统一响应状态码枚举
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    /**
     * 成功响应
     */
    SUCCESS("200", "成功"),

    /**
     * 参数错误
     */
    PARAM_ERROR("400", "参数错误"),

    /**
     * 数据未找到
     */
    DATA_NOT_FOUND("404", "数据未找到"),

    /**
     * 业务处理异常
     */
    BUSINESS_ERROR("422", "业务处理异常"),

    /**
     * 系统内部错误
     */
    SYSTEM_ERROR("500", "系统内部错误"),

    /**
     * 服务不可用
     */
    SERVICE_UNAVAILABLE("503", "服务不可用");

    /**
     * 状态码
     */
    private final String code;

    /**
     * 状态消息
     */
    private final String message;

    /**
     * 通过状态码获取枚举，未知状态码归为系统错误
     */
    public static ResponseCode getByCode(String code) {
        for (ResponseCode responseCode : values()) {
            if (responseCode.getCode().equals(code)) {
                return responseCode;
            }
        }
        return SYSTEM_ERROR;
    }
}
