package com.percussion.scoredb.dto;

public record CaptionScoreDTO(String caption, Double weight, Double compScore, Double perfScore, Integer placement) {
}
