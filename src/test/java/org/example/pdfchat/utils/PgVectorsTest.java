package org.example.pdfchat.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgVectorsTest {

    @Test
    void literalMatchesPgvectorTextFormat() {
        assertThat(PgVectors.toLiteral(new float[]{0.25f, -1f, 3f})).isEqualTo("[0.25,-1.0,3.0]");
        assertThat(PgVectors.toLiteral(new float[0])).isEqualTo("[]");
    }

    @Test
    void parsesDatabaseOutputWithSpaces() {
        assertThat(PgVectors.fromLiteral(" [0.5, 1, -2] ")).containsExactly(0.5f, 1f, -2f);
        assertThat(PgVectors.fromLiteral("[]")).isEmpty();
    }

    @Test
    void rejectsNonVectorText() {
        assertThatThrownBy(() -> PgVectors.fromLiteral("0.1,0.2"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
