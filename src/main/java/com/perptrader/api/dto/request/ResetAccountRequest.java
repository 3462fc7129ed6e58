package com.perptrader.api.dto.request;

import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class ResetAccountRequest {

    /** New starting equity; null keeps the current one. */
    @Positive
    private BigDecimal startingEquity;
}
