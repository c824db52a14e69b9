package io.nightly.standards.mail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import javax.mail.Authenticator;
import javax.mail.MessagingException;
import javax.mail.PasswordAuthentication;
import javax.mail.Session;
import javax.mail.Transport;
import javax.mail.internet.InternetAddress;
import javax.mail.internet.MimeBodyPart;
import javax.mail.internet.MimeMessage;
import javax.mail.internet.MimeMultipart;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.nightly.core.config.Config;
import io.nightly.spi.MailException;
import io.nightly.spi.MailProvider;

/**
 * Sends backups over SMTP using {@code mail.*} settings.
 */
public class SmtpMailProvider
        implements MailProvider
{
    private final Config config;
    private final Optional<String> from;

    @Inject
    public SmtpMailProvider(Config systemConfig)
    {
        this.config = systemConfig.deepCopy();
        this.from = config.getOptional("mail.from", String.class);
    }

    @Override
    public void send(String to, String subject, String body, Path attachment)
        throws MailException
    {
        if (!from.isPresent()) {
            throw new MailException("mail.from is not set");
        }

        Session session = createSession();
        MimeMessage msg = new MimeMessage(session);
        try {
            msg.setFrom(new InternetAddress(from.get()));
            msg.setSender(new InternetAddress(from.get()));
            msg.setRecipients(MimeMessage.RecipientType.TO, InternetAddress.parse(to, true));
            msg.setSubject(subject, "utf-8");

            MimeBodyPart text = new MimeBodyPart();
            text.setText(body, "utf-8", "plain");
            MimeBodyPart file = new MimeBodyPart();
            file.attachFile(attachment.toFile());

            MimeMultipart multipart = new MimeMultipart();
            multipart.addBodyPart(text);
            multipart.addBodyPart(file);
            msg.setContent(multipart);

            Transport.send(msg);
        }
        catch (MessagingException | IOException ex) {
            throw new MailException("Failed to send mail to " + to, ex);
        }
    }

    private Session createSession()
    {
        Properties props = new Properties();

        String port = config.get("mail.port", String.class, "25");
        props.setProperty("mail.smtp.host", config.get("mail.host", String.class, "localhost"));
        props.setProperty("mail.smtp.port", port);
        props.put("mail.smtp.starttls.enable", Boolean.toString(config.get("mail.tls", boolean.class, true)));
        if (config.get("mail.ssl", boolean.class, false)) {
            props.put("mail.smtp.socketFactory.port", port);
            props.put("mail.smtp.socketFactory.class", "javax.net.ssl.SSLSocketFactory");
            props.put("mail.smtp.socketFactory.fallback", "false");
        }

        props.setProperty("mail.debug", Boolean.toString(config.get("mail.debug", boolean.class, false)));

        props.setProperty("mail.smtp.connectiontimeout", "10000");
        props.setProperty("mail.smtp.timeout", "60000");

        final Optional<String> username = config.getOptional("mail.username", String.class);
        if (username.isPresent()) {
            props.setProperty("mail.smtp.auth", "true");
            final String password = config.get("mail.password", String.class, "");
            return Session.getInstance(props,
                    new Authenticator()
                    {
                        @Override
                        public PasswordAuthentication getPasswordAuthentication()
                        {
                            return new PasswordAuthentication(username.get(), password);
                        }
                    });
        }
        return Session.getInstance(props);
    }
}
