package com.zzf.miku.api;

import lombok.Value;

@Value
public class ErrorResponse {
    String code;
    String message;
}
