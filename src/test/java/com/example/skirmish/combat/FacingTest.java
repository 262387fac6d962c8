package com.example.skirmish.combat;

import com.example.skirmish.model.Vec2;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Facing Tests")
public class FacingTest {

    @ParameterizedTest
    @CsvSource({
        "3, 1, RIGHT",
        "-3, 1, LEFT",
        "1, 3, UP",
        "1, -3, DOWN",
        "2, 2, UP",
        "-2, -2, DOWN",
        "0, 0, UP"
    })
    @DisplayName("Facing follows the dominant axis")
    void toward(double dx, double dy, Facing expected) {
        assertEquals(expected, Facing.toward(Vec2.of(5, 5), Vec2.of(5 + dx, 5 + dy)));
    }

    @Test
    @DisplayName("Index round trip")
    void indexRoundTrip() {
        for (Facing f : Facing.values()) {
            assertEquals(f, Facing.fromIndex(f.getIndex()));
        }
        assertEquals(Facing.DOWN, Facing.fromIndex(42));
    }
}
