package com.jz.hive.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class Result<T> {
    private Integer code;
    private String message;
    private T data;

    public static <T> Result<T> success(T data) {
        return of(200, "success", data);
    }

    public static <T> Result<T> created(T data) {
        return of(201, "created", data);
    }

    /** 业务拒绝（如审核拦截）：带上 data，前端需要展示剩余警告次数 */
    public static <T> Result<T> rejected(String msg, T data) {
        return of(403, msg, data);
    }

    public static <T> Result<T> fail(int code, String msg) {
        return of(code, msg, null);
    }

    public static <T> Result<T> error(String msg) {
        return of(500, msg, null);
    }
}
