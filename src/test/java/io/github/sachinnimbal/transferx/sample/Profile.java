package io.github.sachinnimbal.transferx.sample;

import jakarta.validation.constraints.NotBlank;

public record Profile(@NotBlank String first_name, String last_name) {
}
