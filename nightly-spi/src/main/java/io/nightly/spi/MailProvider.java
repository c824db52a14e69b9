package io.nightly.spi;

import java.nio.file.Path;

public interface MailProvider
{
    void send(String to, String subject, String body, Path attachment)
        throws MailException;
}
