package org.minnen.ftcstanding.lambda;

/** Named lambda selection strategies. */
public enum LambdaStrategy
{
  FIXED_BAND("fixed-band"), CONTINUOUS("continuous"), AUTO_TUNED("auto-tuned"), TEAM_COUNT("team-count"),
  CONSTANT("constant");

  public final String key;

  private LambdaStrategy(String key)
  {
    this.key = key;
  }

  /** @return strategy matching the given key (or enum name), ignoring case */
  public static LambdaStrategy parse(String s)
  {
    String t = s.trim();
    for (LambdaStrategy strategy : values()) {
      if (strategy.key.equalsIgnoreCase(t) || strategy.name().equalsIgnoreCase(t)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown lambda strategy: [%s]", s));
  }

  @Override
  public String toString()
  {
    return key;
  }
}
