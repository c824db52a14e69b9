package io.nightly.standards.mail;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.mail.BodyPart;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeMultipart;
import io.nightly.core.config.Config;
import io.nightly.core.config.ConfigFactory;
import io.nightly.core.config.ObjectMappers;
import io.nightly.spi.MailException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.subethamail.wiser.Wiser;
import org.subethamail.wiser.WiserMessage;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class SmtpMailProviderTest
{
    private static final String HOSTNAME = "127.0.0.1";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final ConfigFactory cf = new ConfigFactory(ObjectMappers.create());

    private int port;
    private Wiser mailServer;

    @Before
    public void setUp()
        throws IOException
    {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            port = socket.getLocalPort();
        }
        mailServer = new Wiser();
        mailServer.setHostname(HOSTNAME);
        mailServer.setPort(port);
        mailServer.start();
    }

    @After
    public void tearDown()
    {
        if (mailServer != null) {
            mailServer.stop();
        }
    }

    private Config smtpConfig()
    {
        return cf.create()
            .set("mail.host", HOSTNAME)
            .set("mail.port", String.valueOf(port))
            .set("mail.from", "backups@example.com")
            .set("mail.tls", "false");
    }

    @Test
    public void sendsArchiveAsAttachment()
        throws Exception
    {
        Path attachment = folder.newFile("backup--job_1--daily--2024-01-10_02-00-05.sql").toPath();
        Files.write(attachment, "CREATE TABLE t (id int);".getBytes(UTF_8));

        new SmtpMailProvider(smtpConfig()).send("dba@example.com",
                "Database Backup - 2024-01-10 02:00:05",
                "Attached is your database backup.",
                attachment);

        List<WiserMessage> messages = mailServer.getMessages();
        assertThat(messages.size(), is(1));
        assertThat(messages.get(0).getEnvelopeReceiver(), is("dba@example.com"));
        assertThat(messages.get(0).getEnvelopeSender(), is("backups@example.com"));

        MimeMessage msg = messages.get(0).getMimeMessage();
        assertThat(msg.getSubject(), is("Database Backup - 2024-01-10 02:00:05"));
        assertThat(msg.getFrom()[0].toString(), is("backups@example.com"));

        MimeMultipart multipart = (MimeMultipart) msg.getContent();
        assertThat(multipart.getCount(), is(2));
        assertThat(multipart.getBodyPart(0).getContent().toString(), containsString("Attached is your database backup."));
        BodyPart file = multipart.getBodyPart(1);
        assertThat(file.getFileName(), is("backup--job_1--daily--2024-01-10_02-00-05.sql"));
    }

    @Test(expected = MailException.class)
    public void fromAddressIsRequired()
        throws Exception
    {
        Path attachment = folder.newFile("dump.sql").toPath();
        new SmtpMailProvider(smtpConfig().remove("mail.from"))
            .send("dba@example.com", "subject", "body", attachment);
    }

    @Test(expected = MailException.class)
    public void invalidRecipientIsReported()
        throws Exception
    {
        Path attachment = folder.newFile("dump.sql").toPath();
        new SmtpMailProvider(smtpConfig())
            .send("<dba@example.com", "subject", "body", attachment);
    }
}
