package com.example.rentalchat.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserSummary {

    private String id;
    private String name;
    private String photoUrl;
    private String role;

    public static UserSummary idOnly(String id) {
        return UserSummary.builder().id(id).build();
    }
}
