package com.textdiagram.core.canvas;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Canvas} and {@link BoxGlyphs}.
 */
class CanvasTest {

    private static final char[] MERGEABLE = {
        BoxGlyphs.HORIZONTAL, BoxGlyphs.VERTICAL,
        BoxGlyphs.TOP_LEFT, BoxGlyphs.TOP_RIGHT, BoxGlyphs.BOTTOM_LEFT, BoxGlyphs.BOTTOM_RIGHT,
        BoxGlyphs.TEE_DOWN, BoxGlyphs.TEE_UP, BoxGlyphs.TEE_RIGHT, BoxGlyphs.TEE_LEFT, BoxGlyphs.CROSS,
        BoxGlyphs.DOUBLE_HORIZONTAL, BoxGlyphs.DOUBLE_VERTICAL, BoxGlyphs.DOUBLE_TOP_LEFT, BoxGlyphs.DOUBLE_CROSS,
        BoxGlyphs.DASHED_HORIZONTAL, BoxGlyphs.DASHED_VERTICAL
    };

    @Test
    void render_blankCanvas_producesEmptyRows() {
        assertThat(new Canvas(3, 2).render()).isEqualTo("\n");
    }

    @Test
    void render_trimsTrailingWhitespace() {
        Canvas canvas = new Canvas(6, 1);
        canvas.write(0, 1, "ab");

        assertThat(canvas.render()).isEqualTo(" ab");
    }

    @Test
    void write_wideCharacter_occupiesTwoCells() {
        Canvas canvas = new Canvas(6, 1);
        canvas.write(0, 0, "中x");

        assertThat(canvas.cell(0, 1).isContinuation()).isTrue();
        assertThat(canvas.cell(0, 2).codePoint()).isEqualTo('x');
        assertThat(canvas.render()).isEqualTo("中x");
    }

    @Test
    void set_overContinuation_blanksTheWideGlyph() {
        Canvas canvas = new Canvas(4, 1);
        canvas.write(0, 0, "中");
        canvas.set(0, 1, '|');

        assertThat(canvas.render()).isEqualTo(" |");
    }

    @Test
    void set_overWideGlyph_clearsItsContinuation() {
        Canvas canvas = new Canvas(4, 1);
        canvas.write(0, 0, "中");
        canvas.set(0, 0, 'a');
        canvas.set(0, 2, 'b');

        assertThat(canvas.render()).isEqualTo("a b");
    }

    @Test
    void writesOutsideTheGrid_areIgnored() {
        Canvas canvas = new Canvas(2, 1);
        canvas.set(-1, 0, 'x');
        canvas.set(0, 5, 'x');
        canvas.write(0, 1, "abc");

        assertThat(canvas.render()).isEqualTo(" a");
    }

    @Test
    void constructor_negativeSize_throws() {
        assertThatThrownBy(() -> new Canvas(-1, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void merge_horizontalOverVertical_yieldsCross() {
        Canvas canvas = new Canvas(1, 1);
        canvas.set(0, 0, BoxGlyphs.VERTICAL);
        canvas.merge(0, 0, BoxGlyphs.HORIZONTAL);

        assertThat(canvas.cell(0, 0).codePoint()).isEqualTo(BoxGlyphs.CROSS);
    }

    @Test
    void merge_cornerOverHorizontal_yieldsTee() {
        Canvas canvas = new Canvas(1, 1);
        canvas.set(0, 0, BoxGlyphs.HORIZONTAL);
        canvas.merge(0, 0, BoxGlyphs.TOP_LEFT);

        assertThat(canvas.cell(0, 0).codePoint()).isEqualTo(BoxGlyphs.TEE_DOWN);
    }

    @Test
    void merge_overText_overwrites() {
        Canvas canvas = new Canvas(1, 1);
        canvas.set(0, 0, 'x');
        canvas.merge(0, 0, BoxGlyphs.VERTICAL);

        assertThat(canvas.cell(0, 0).codePoint()).isEqualTo(BoxGlyphs.VERTICAL);
    }

    @Test
    void merge_dashedLines_joinAsLightJunction() {
        assertThat(BoxGlyphs.merge(BoxGlyphs.DASHED_VERTICAL, BoxGlyphs.DOUBLE_HORIZONTAL))
            .isEqualTo(BoxGlyphs.CROSS);
    }

    @Test
    void merge_overlappingDashedLines_stayDashed() {
        Canvas canvas = new Canvas(2, 2);
        canvas.merge(0, 0, BoxGlyphs.DASHED_HORIZONTAL);
        canvas.merge(0, 0, BoxGlyphs.DASHED_HORIZONTAL);
        canvas.merge(1, 1, BoxGlyphs.DASHED_VERTICAL);
        canvas.merge(1, 1, BoxGlyphs.DASHED_VERTICAL);

        assertThat(canvas.render()).isEqualTo("╌\n ┊");
    }

    @Test
    void merge_crossingDoubleLines_yieldDoubleCross() {
        Canvas canvas = new Canvas(1, 1);
        canvas.merge(0, 0, BoxGlyphs.DOUBLE_VERTICAL);
        canvas.merge(0, 0, BoxGlyphs.DOUBLE_HORIZONTAL);

        assertThat(canvas.cell(0, 0).codePoint()).isEqualTo(BoxGlyphs.DOUBLE_CROSS);
    }

    @Test
    void merge_crossingDashedLines_fallBackToLightCross() {
        assertThat(BoxGlyphs.merge(BoxGlyphs.DASHED_VERTICAL, BoxGlyphs.DASHED_HORIZONTAL))
            .isEqualTo(BoxGlyphs.CROSS);
        assertThat(BoxGlyphs.merge(BoxGlyphs.DOUBLE_VERTICAL, BoxGlyphs.HORIZONTAL))
            .isEqualTo(BoxGlyphs.CROSS);
    }

    @Test
    void connect_doubleStyle_drawsDoubleCornersUnlessCellIsLight() {
        Canvas canvas = new Canvas(3, 1);
        canvas.connect(0, 0, BoxGlyphs.RIGHT | BoxGlyphs.DOWN, BoxGlyphs.Style.DOUBLE);
        canvas.set(0, 1, BoxGlyphs.HORIZONTAL);
        canvas.connect(0, 1, BoxGlyphs.DOWN, BoxGlyphs.Style.DOUBLE);
        canvas.connect(0, 2, BoxGlyphs.LEFT | BoxGlyphs.DOWN, BoxGlyphs.Style.DASHED);

        assertThat(canvas.render()).isEqualTo("╔┬┐");
    }

    @ParameterizedTest
    @MethodSource("glyphPairs")
    void merge_isOrderIndependent(char first, char second) {
        Canvas forward = new Canvas(1, 1);
        forward.merge(0, 0, first);
        forward.merge(0, 0, second);

        Canvas backward = new Canvas(1, 1);
        backward.merge(0, 0, second);
        backward.merge(0, 0, first);

        assertThat(forward.cell(0, 0)).isEqualTo(backward.cell(0, 0));
    }

    @Test
    void connect_barEnds_produceCornersAndTee() {
        Canvas canvas = new Canvas(3, 1);
        canvas.connect(0, 0, BoxGlyphs.RIGHT | BoxGlyphs.DOWN);
        canvas.connect(0, 1, BoxGlyphs.LEFT | BoxGlyphs.RIGHT);
        canvas.connect(0, 1, BoxGlyphs.UP);
        canvas.connect(0, 2, BoxGlyphs.LEFT | BoxGlyphs.DOWN);

        assertThat(canvas.render()).isEqualTo("┌┴┐");
    }

    static Stream<Arguments> glyphPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (char a : MERGEABLE) {
            for (char b : MERGEABLE) {
                pairs.add(Arguments.of(a, b));
            }
        }
        return pairs.stream();
    }
}
