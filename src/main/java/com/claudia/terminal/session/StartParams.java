package com.claudia.terminal.session;

/**
 * Parameters of a start request.
 *
 * <p>Only {@code workingDirectory} is required; everything else defaults to off/absent.
 */
public final class StartParams {

  private final String id;
  private final String workingDirectory;
  private final boolean bypassPermissions;
  private final boolean background;
  private final boolean resume;
  private final String resumeToken;
  private final boolean continueLast;
  private final boolean useMultiplexer;
  private final String reconnectTarget;
  private final String label;
  private final String ownerId;
  private final boolean sandboxed;

  private StartParams(Builder b) {
    this.id = b.id;
    this.workingDirectory = b.workingDirectory;
    this.bypassPermissions = b.bypassPermissions;
    this.background = b.background;
    this.resume = b.resume;
    this.resumeToken = b.resumeToken;
    this.continueLast = b.continueLast;
    this.useMultiplexer = b.useMultiplexer;
    this.reconnectTarget = b.reconnectTarget;
    this.label = b.label;
    this.ownerId = b.ownerId;
    this.sandboxed = b.sandboxed;
  }

  public String id() {
    return id;
  }

  public String workingDirectory() {
    return workingDirectory;
  }

  public boolean bypassPermissions() {
    return bypassPermissions;
  }

  public boolean background() {
    return background;
  }

  public boolean resume() {
    return resume;
  }

  public String resumeToken() {
    return resumeToken;
  }

  public boolean continueLast() {
    return continueLast;
  }

  public boolean useMultiplexer() {
    return useMultiplexer;
  }

  public String reconnectTarget() {
    return reconnectTarget;
  }

  public String label() {
    return label;
  }

  public String ownerId() {
    return ownerId;
  }

  public boolean sandboxed() {
    return sandboxed;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String id;
    private String workingDirectory;
    private boolean bypassPermissions;
    private boolean background;
    private boolean resume;
    private String resumeToken;
    private boolean continueLast;
    private boolean useMultiplexer;
    private String reconnectTarget;
    private String label;
    private String ownerId;
    private boolean sandboxed;

    private Builder() {
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder workingDirectory(String workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder bypassPermissions(boolean bypassPermissions) {
      this.bypassPermissions = bypassPermissions;
      return this;
    }

    public Builder background(boolean background) {
      this.background = background;
      return this;
    }

    public Builder resume(boolean resume) {
      this.resume = resume;
      return this;
    }

    public Builder resumeToken(String resumeToken) {
      this.resumeToken = resumeToken;
      return this;
    }

    public Builder continueLast(boolean continueLast) {
      this.continueLast = continueLast;
      return this;
    }

    public Builder useMultiplexer(boolean useMultiplexer) {
      this.useMultiplexer = useMultiplexer;
      return this;
    }

    public Builder reconnectTarget(String reconnectTarget) {
      this.reconnectTarget = reconnectTarget;
      return this;
    }

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    public Builder sandboxed(boolean sandboxed) {
      this.sandboxed = sandboxed;
      return this;
    }

    public StartParams build() {
      return new StartParams(this);
    }
  }
}
