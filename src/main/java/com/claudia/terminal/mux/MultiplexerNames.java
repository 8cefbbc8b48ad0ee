package com.claudia.terminal.mux;

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Derives multiplexer group names from session ids and labels.
 *
 * <p>Names have the form {@code <prefix>-<label>-<short id>} (or {@code <prefix>-<short id>}
 * without a label) and only contain {@code [a-z0-9_-]}, so they are safe as tmux targets.
 *
 * @since 1.0
 */
public final class MultiplexerNames {

  static final int MAX_LABEL_LENGTH = 32;
  static final int SHORT_ID_LENGTH = 12;

  private MultiplexerNames() {
  }

  /**
   * Builds the group name for a session.
   *
   * @param prefix name prefix shared by every group this server creates
   * @param sessionId session id
   * @param label optional label (may be null)
   * @return group name
   */
  public static String groupName(final String prefix, final String sessionId, final String label) {
    Validate.notBlank(prefix, "prefix must not be blank");
    Validate.notBlank(sessionId, "sessionId must not be blank");
    final StringBuilder name = new StringBuilder(sanitize(prefix));
    final String cleanLabel = StringUtils.left(sanitize(label), MAX_LABEL_LENGTH);
    if (StringUtils.isNotEmpty(cleanLabel)) {
      name.append('-').append(cleanLabel);
    }
    name.append('-').append(StringUtils.right(sanitize(sessionId), SHORT_ID_LENGTH));
    return name.toString();
  }

  /**
   * Returns whether a group name was produced with the given prefix.
   *
   * @param prefix name prefix
   * @param groupName group name
   * @return true if owned
   */
  public static boolean isOwned(final String prefix, final String groupName) {
    return groupName != null && groupName.startsWith(sanitize(prefix) + "-");
  }

  static String sanitize(final String value) {
    if (StringUtils.isBlank(value)) {
      return "";
    }
    final String lowered = value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]+", "-");
    return StringUtils.strip(lowered, "-");
  }
}
