package com.percussion.scoredb.controller;

import com.percussion.scoredb.repository.CaptionWeightRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
class SeasonControllerTest {

    @Autowired private MockMvc mvc;
    @Autowired private CaptionWeightRepository captionWeightRepository;

    @BeforeEach
    void setUp() {
        captionWeightRepository.deleteAll();
    }

    @Test
    void putThenGet_returnsWeightsSortedByCaption() throws Exception {
        mvc.perform(put("/api/seasons/2030/caption-weights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"caption\":\"Visual\",\"weight\":20},{\"caption\":\"Music\",\"weight\":30}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mvc.perform(put("/api/seasons/2030/caption-weights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"caption\":\"Music\",\"weight\":35.5}]"))
                .andExpect(status().isOk());

        mvc.perform(get("/api/seasons/2030/caption-weights").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].caption").value("Music"))
                .andExpect(jsonPath("$[0].weight").value(35.5))
                .andExpect(jsonPath("$[1].caption").value("Visual"));
    }

    @Test
    void put_rejectsOutOfRangeWeight() throws Exception {
        mvc.perform(put("/api/seasons/2030/caption-weights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"caption\":\"Music\",\"weight\":120}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("between 0 and 100")));

        mvc.perform(get("/api/seasons/2030/caption-weights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", empty()));
    }

    @Test
    void put_rejectsEmptyList() throws Exception {
        mvc.perform(put("/api/seasons/2030/caption-weights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void get_unknownSeason_returnsEmptyList() throws Exception {
        mvc.perform(get("/api/seasons/1999/caption-weights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", empty()));
    }
}
