package com.example.autopilot.domain;

import java.io.Serializable;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingItem implements Serializable {

    private String id;
    private String name;
    private BigDecimal listedPrice;
    private BigDecimal bottomPrice;
}
