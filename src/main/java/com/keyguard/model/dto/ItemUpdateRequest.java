package com.keyguard.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Request DTO for a partial item update.
 *
 * Jackson calls a setter only for properties present in the body, so the
 * setters record which fields were sent. An explicit null is a present field.
 */
@Getter
@ToString
@NoArgsConstructor
public class ItemUpdateRequest {

    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    @Size(max = 5000, message = "Description cannot exceed 5000 characters")
    private String description;

    private final Set<String> presentFields = new HashSet<>();

    public void setName(String name) {
        this.name = name;
        presentFields.add(NAME);
    }

    public void setDescription(String description) {
        this.description = description;
        presentFields.add(DESCRIPTION);
    }

    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }

    @JsonIgnore
    public Set<String> getPresentFields() {
        return Collections.unmodifiableSet(presentFields);
    }
}
