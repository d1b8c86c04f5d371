package dev.tutordesk.sheet;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class IdSequenceTest {

  @Test
  void continuesAfterHighestSequenceOfPrefix() {
    assertThat(IdSequence.next("gMA", List.of("gMA001", "gMA017", "gEN042", "gMA003")))
        .isEqualTo("gMA018");
  }

  @Test
  void startsAtOneWithoutMatches() {
    assertThat(IdSequence.next("s", List.of("", "t005", "s-1"))).isEqualTo("s001");
  }

  @Test
  void longerPrefixesDoNotCount() {
    assertThat(IdSequence.next("s", List.of("st009"))).isEqualTo("s001");
  }

  @Test
  void widensPastThreeDigits() {
    assertThat(IdSequence.next("s", List.of(" s999 "))).isEqualTo("s1000");
  }

  @Test
  void prefixIsMatchedLiterally() {
    assertThat(IdSequence.next("g.", List.of("gX001", "g.002"))).isEqualTo("g.003");
  }
}
