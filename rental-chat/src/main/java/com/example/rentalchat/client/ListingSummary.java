package com.example.rentalchat.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListingSummary {

    private String id;
    private String title;
    private String location;
    private BigDecimal price;

    public static ListingSummary idOnly(String id) {
        return ListingSummary.builder().id(id).build();
    }
}
