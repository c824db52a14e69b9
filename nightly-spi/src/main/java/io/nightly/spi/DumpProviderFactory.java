package io.nightly.spi;

public interface DumpProviderFactory
{
    String getType();

    DumpProvider open();
}
