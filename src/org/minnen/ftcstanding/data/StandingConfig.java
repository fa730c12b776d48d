package org.minnen.ftcstanding.data;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.minnen.ftcstanding.lambda.AutoTunedPolicy;
import org.minnen.ftcstanding.lambda.ConstantPolicy;
import org.minnen.ftcstanding.lambda.ContinuousPolicy;
import org.minnen.ftcstanding.lambda.FixedBandPolicy;
import org.minnen.ftcstanding.lambda.LambdaStrategy;
import org.minnen.ftcstanding.lambda.RegularizationPolicy;
import org.minnen.ftcstanding.lambda.TeamCountPolicy;

/** Settings for lambda selection and metric calculation. */
public class StandingConfig
{
  public static final String DEFAULT_RESOURCE = "ftcstanding.properties";
  public static final String CONFIG_PROPERTY  = "ftcstanding.config";

  private LambdaStrategy     strategy         = LambdaStrategy.FIXED_BAND;
  private double             lambda           = 0.0;
  private double             targetCondition  = AutoTunedPolicy.DEFAULT_TARGET_CONDITION;
  private double             maxLambda        = AutoTunedPolicy.DEFAULT_MAX_LAMBDA;
  private int                maxIterations    = AutoTunedPolicy.DEFAULT_MAX_ITERATIONS;
  private int                threads          = 1;

  /** Update settings from the given `config`; missing keys keep their current values. */
  public void configure(Configuration config)
  {
    if (config.containsKey("lambda.strategy")) {
      strategy = LambdaStrategy.parse(config.getString("lambda.strategy"));
    }
    lambda = config.getDouble("lambda.value", lambda);
    targetCondition = config.getDouble("lambda.targetCondition", targetCondition);
    maxLambda = config.getDouble("lambda.maxLambda", maxLambda);
    maxIterations = config.getInt("lambda.maxIterations", maxIterations);
    threads = config.getInt("performance.threads", threads);
    if (threads < 1) {
      throw new IllegalArgumentException(String.format("Need at least one thread (%d)", threads));
    }
  }

  /**
   * Load the default settings from the classpath and then overrides from the file named by the `ftcstanding.config`
   * system property (if any).
   */
  public static StandingConfig load() throws IOException
  {
    StandingConfig settings = new StandingConfig();
    try (InputStream in = StandingConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in != null) {
        settings.configure(read(new InputStreamReader(in, StandardCharsets.UTF_8)));
      }
    }

    String path = System.getProperty(CONFIG_PROPERTY);
    if (path != null) {
      File file = new File(path);
      if (!file.canRead()) {
        throw new IOException(String.format("Can't read config file (%s)", file.getPath()));
      }
      System.out.printf("Loading config file: [%s]\n", file.getPath());
      try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
        settings.configure(read(reader));
      }
    }
    return settings;
  }

  /** Read properties-format settings. */
  public static PropertiesConfiguration read(Reader reader) throws IOException
  {
    PropertiesConfiguration config = new PropertiesConfiguration();
    try {
      config.read(reader);
    } catch (ConfigurationException e) {
      throw new IOException("Failed to parse configuration", e);
    }
    return config;
  }

  /** @return regularization policy described by these settings */
  public RegularizationPolicy buildPolicy()
  {
    switch (strategy) {
    case FIXED_BAND:
      return new FixedBandPolicy();
    case CONTINUOUS:
      return new ContinuousPolicy();
    case AUTO_TUNED:
      return new AutoTunedPolicy(targetCondition, maxLambda, maxIterations);
    case TEAM_COUNT:
      return new TeamCountPolicy();
    case CONSTANT:
      return new ConstantPolicy(lambda);
    default:
      throw new IllegalStateException("Unsupported lambda strategy: " + strategy);
    }
  }

  public LambdaStrategy getStrategy()
  {
    return strategy;
  }

  public double getLambda()
  {
    return lambda;
  }

  public int getThreads()
  {
    return threads;
  }
}
