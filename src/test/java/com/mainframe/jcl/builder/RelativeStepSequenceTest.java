package com.mainframe.jcl.builder;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RelativeStepSequenceTest {

    @Test
    void testFormat() {
        RelativeStepSequence sequence = new RelativeStepSequence();

        assertThat(sequence.next()).isEqualTo("X0000001");
        assertThat(sequence.next()).isEqualTo("X0000002");
        assertThat(sequence.getCounter()).isEqualTo(2);
    }

    @Test
    void testTierMustBeALetter() {
        assertThatThrownBy(() -> new RelativeStepSequence('1'))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new RelativeStepSequence('b').getTier()).isEqualTo('B');
    }
}
