package ru.kfl.leasingsync.shared.dto.user;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserPayload(
        @JsonProperty("telegram_id") Long telegramId,
        String username,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("language_code") String languageCode,
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("avatar_file_id") String avatarFileId,
        String role,
        @JsonProperty("is_authenticated") Boolean authenticated,
        @JsonProperty("authenticated_at") String authenticatedAt
) {
    public UserPayload withRole(String newRole) {
        return new UserPayload(telegramId, username, firstName, lastName, languageCode,
                phoneNumber, avatarFileId, newRole, authenticated, authenticatedAt);
    }
}
