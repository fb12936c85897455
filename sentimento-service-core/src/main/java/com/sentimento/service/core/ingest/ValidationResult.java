package com.sentimento.service.core.ingest;

import com.sentimento.live.model.LiveEvent;

public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    record Valid(LiveEvent event) implements ValidationResult {}

    record Invalid(ValidationError error) implements ValidationResult {}

    static ValidationResult invalid(String field, String message) {
        return new Invalid(new ValidationError(field, message));
    }
}
