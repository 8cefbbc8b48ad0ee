package com.claudia.terminal.mux;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for group name derivation.
 *
 * @since 1.0
 */
public class MultiplexerNamesTest {

  @Test
  @DisplayName("Should combine prefix, sanitized label and id tail")
  void groupName_WithLabel_Combined() {
    assertThat(MultiplexerNames.groupName("claudia", "session-1700000000000-ab12cd34", "My Project!"))
        .isEqualTo("claudia-my-project-000-ab12cd34");
  }

  @Test
  @DisplayName("Should omit a blank label")
  void groupName_NoLabel_PrefixAndId() {
    assertThat(MultiplexerNames.groupName("claudia", "abc", "  ")).isEqualTo("claudia-abc");
  }

  @Test
  @DisplayName("Should cap the label length")
  void groupName_LongLabel_Truncated() {
    final String name = MultiplexerNames.groupName("c", "id1", "x".repeat(100));

    assertThat(name).isEqualTo("c-" + "x".repeat(MultiplexerNames.MAX_LABEL_LENGTH) + "-id1");
  }

  @Test
  @DisplayName("Should recognize only names carrying the prefix")
  void isOwned_ForeignName_False() {
    assertThat(MultiplexerNames.isOwned("claudia", "claudia-abc")).isTrue();
    assertThat(MultiplexerNames.isOwned("claudia", "claudiax-abc")).isFalse();
    assertThat(MultiplexerNames.isOwned("claudia", "work")).isFalse();
    assertThat(MultiplexerNames.isOwned("claudia", null)).isFalse();
  }
}
