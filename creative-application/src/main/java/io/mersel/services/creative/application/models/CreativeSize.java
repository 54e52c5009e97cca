package io.mersel.services.creative.application.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Kreatif piksel boyutu.
 */
@JsonPropertyOrder({"width", "height"})
public record CreativeSize(int width, int height) {
}
