package com.percussion.scoredb.pdf;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TextGridBuilderTest {

    private static final ExtractionProfile STRICT = new ExtractionProfile("strict", 2f, 5f);

    @Test
    void buildsGridAndFoldsStackedValuesIntoOneCell() {
        List<Glyph> glyphs = new ArrayList<>();
        word(glyphs, "Recap", 10, 10);
        word(glyphs, "G", 10, 30);
        word(glyphs, "H", 100, 30);
        word(glyphs, "M", 200, 30);
        word(glyphs, "Grp", 10, 40);
        word(glyphs, "City", 100, 40);
        word(glyphs, "Mus", 200, 40);
        word(glyphs, "Alpha", 10, 60);
        word(glyphs, "Town", 100, 60);
        word(glyphs, "1", 200, 60);
        word(glyphs, "2", 200, 70);
        word(glyphs, "Beta", 10, 90);
        word(glyphs, "Ville", 100, 90);
        word(glyphs, "3", 200, 90);

        Optional<RawTable> table = new TextGridBuilder(STRICT).build(glyphs);

        assertThat(table).isPresent();
        List<List<String>> cells = table.get().cells();
        assertThat(cells).hasSize(4);
        assertThat(cells.get(0)).containsExactly("G", "H", "M");
        assertThat(cells.get(1)).containsExactly("Grp", "City", "Mus");
        assertThat(cells.get(2)).containsExactly("Alpha", "Town", "1\n2");
        assertThat(cells.get(3)).containsExactly("Beta", "Ville", "3");
    }

    @Test
    void keepsSpacesInsideARun() {
        List<Glyph> glyphs = new ArrayList<>();
        word(glyphs, "A", 10, 30);
        word(glyphs, "B", 100, 30);
        word(glyphs, "C", 200, 30);
        word(glyphs, "X", 10, 40);
        word(glyphs, "Y", 100, 40);
        word(glyphs, "Z", 200, 40);
        word(glyphs, "Arcadia", 10, 60);
        word(glyphs, "HS", 47, 60);
        word(glyphs, "Arcadia,", 100, 60);
        word(glyphs, "9", 200, 60);

        List<List<String>> cells = new TextGridBuilder(STRICT).build(glyphs).orElseThrow().cells();

        assertThat(cells.get(2).get(0)).isEqualTo("Arcadia HS");
    }

    @Test
    void noTableWhenNoLineHasEnoughColumns() {
        List<Glyph> glyphs = new ArrayList<>();
        word(glyphs, "Arcadia", 10, 10);
        word(glyphs, "September", 10, 20);
        word(glyphs, "Notes", 10, 30);
        word(glyphs, "More", 100, 30);

        assertThat(new TextGridBuilder(STRICT).build(glyphs)).isEmpty();
    }

    @Test
    void headerOnlyIsNotATable() {
        List<Glyph> glyphs = new ArrayList<>();
        word(glyphs, "A", 10, 30);
        word(glyphs, "B", 100, 30);
        word(glyphs, "C", 200, 30);
        word(glyphs, "X", 10, 40);
        word(glyphs, "Y", 100, 40);
        word(glyphs, "Z", 200, 40);

        assertThat(new TextGridBuilder(STRICT).build(glyphs)).isEmpty();
    }

    private static void word(List<Glyph> out, String text, float x, float y) {
        float w = 5f;
        for (int i = 0; i < text.length(); i++) {
            out.add(new Glyph(x + i * w, y, w, String.valueOf(text.charAt(i))));
        }
    }
}
