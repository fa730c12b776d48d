package org.minnen.ftcstanding.tests;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({ TestLinearAlgebra.class, TestConditioning.class, TestDesignMatrixBuilder.class,
    TestLambdaPolicies.class, TestPerformanceCalculator.class, TestMatch.class, TestMatchIO.class,
    TestEventRanker.class, TestSeasonAggregator.class, TestStandingConfig.class })
public class AllTests
{}
