package io.nightly.core.config;

import java.util.Properties;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigTest
{
    private final ConfigFactory factory = new ConfigFactory(ObjectMappers.create());

    @Test
    public void readsPropertiesAsTypedValues()
    {
        Properties props = new Properties();
        props.setProperty("schedule.max_workers", "4");
        props.setProperty("schedule.enabled", "false");
        props.setProperty("backup.dir", "/var/backups");

        Config config = PropertyUtils.toConfigElement(props).toConfig(factory);

        assertThat(config.get("schedule.max_workers", int.class), is(4));
        assertThat(config.get("schedule.enabled", boolean.class), is(false));
        assertThat(config.get("backup.dir", String.class), is("/var/backups"));
        assertThat(config.get("retention.daily", int.class, 30), is(30));
        assertThat(config.getOptional("mail.host", String.class).isPresent(), is(false));
    }

    @Test
    public void reportsMissingAndMalformedValues()
    {
        Config config = factory.create().set("retention.daily", "thirty");
        try {
            config.get("retention.daily", int.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected integer (int) type for key 'retention.daily'"));
        }
        try {
            config.get("mail.host", String.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), is("Parameter 'mail.host' is required but not set"));
        }
    }

    @Test
    public void elementIsDetachedFromSource()
    {
        Config source = factory.create().set("timezone", "Asia/Tokyo");
        ConfigElement element = ConfigElement.copyOf(source);
        source.set("timezone", "UTC");

        assertThat(element.toConfig(factory).get("timezone", String.class), is("Asia/Tokyo"));
    }

    @Test
    public void deepCopyIsIndependent()
    {
        Config base = factory.create().set("a", 1).set("b", "x");

        Config copy = base.deepCopy().set("a", 2).remove("b");

        assertThat(copy.get("a", int.class), is(2));
        assertThat(copy.has("b"), is(false));
        assertThat(base.get("a", int.class), is(1));
        assertThat(base.get("b", String.class), is("x"));
    }

    @Test(expected = ConfigException.class)
    public void invalidTimezoneIsRejected()
    {
        new ClockProvider(factory.create().set("timezone", "Mars/Olympus"));
    }

    @Test
    public void clockUsesConfiguredZone()
    {
        ClockProvider provider = new ClockProvider(factory.create().set("timezone", "Asia/Tokyo"));
        assertThat(provider.get().getZone().getId(), is("Asia/Tokyo"));
        assertThat(new ClockProvider(factory.create()).get().getZone().getId(), is("UTC"));
    }
}
