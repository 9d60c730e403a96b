package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Partial ad update sent by the bot. Only non-null fields are serialized, so
 * the gateway sees exactly the fields the user touched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdChanges(
        String title,
        String category,
        Long price,
        Integer year,
        String details,
        String location,
        String image,
        String status
) {

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && category == null && price == null && year == null
                && details == null && location == null && image == null && status == null;
    }
}
