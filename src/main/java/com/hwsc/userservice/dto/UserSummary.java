package com.hwsc.userservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hwsc.userservice.entity.Account;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {

    private String uuid;
    private String firstName;
    private String lastName;
    private String email;
    private String organization;
    private Instant createdAt;
    private boolean verified;
    private String prospectiveEmail;

    public static UserSummary from(Account account) {
        return UserSummary.builder()
                .uuid(account.getId())
                .firstName(account.getFirstName())
                .lastName(account.getLastName())
                .email(account.getEmail())
                .organization(account.getOrganization())
                .createdAt(account.getCreatedAt())
                .verified(account.isVerified())
                .prospectiveEmail(account.getProspectiveEmail())
                .build();
    }
}
