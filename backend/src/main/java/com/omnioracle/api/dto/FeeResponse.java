package com.omnioracle.api.dto;

import com.omnioracle.domain.FeeQuote;

public record FeeResponse(String nativeFee, String lzTokenFee) {

    public static FeeResponse from(FeeQuote fee) {
        return new FeeResponse(fee.nativeFee().toString(), fee.lzTokenFee().toString());
    }
}
