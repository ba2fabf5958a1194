package org.broadinstitute.genomics.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.broadinstitute.genomics.GenomicsBaseTest;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends GenomicsBaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][]{
                {Log.LogLevel.ERROR, Level.ERROR},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.DEBUG, Level.DEBUG},
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelMapping(final Log.LogLevel htsjdkLevel, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(htsjdkLevel), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), htsjdkLevel);
    }

    @Test
    public void testSetLoggingLevel() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
        Assert.assertTrue(Log.isEnabled(Log.LogLevel.DEBUG));
        Assert.assertTrue(LogManager.getLogger(LoggingUtilsUnitTest.class).isDebugEnabled());

        LoggingUtils.setLoggingLevel(Log.LogLevel.ERROR);
        Assert.assertFalse(Log.isEnabled(Log.LogLevel.WARNING));
        Assert.assertFalse(LogManager.getLogger(LoggingUtilsUnitTest.class).isWarnEnabled());
    }

    @AfterMethod
    public void restoreVerbosity() {
        setTestVerbosity();
    }
}
