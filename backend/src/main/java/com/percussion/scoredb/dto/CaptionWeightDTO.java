package com.percussion.scoredb.dto;

public record CaptionWeightDTO(String caption, Double weight) {
}
