package org.iceforge.hoard;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.iceforge.hoard.store.HoardObjectMappers;

import java.io.Closeable;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

/**
 * Metadata mapper whose pretty-printing writer fails while {@code failing} is set.
 * Reads and value conversion behave normally.
 */
public final class FailingMetadataWrites {
    private FailingMetadataWrites() {}

    public static ObjectMapper mapper(AtomicBoolean failing) throws Exception {
        ObjectMapper real = HoardObjectMappers.metadataMapper();
        ObjectWriter realWriter = real.writerWithDefaultPrettyPrinter();
        ObjectWriter writer = mock(ObjectWriter.class);
        when(writer.writeValueAsBytes(any())).thenAnswer(inv -> {
            if (failing.get()) {
                throw new JsonMappingException((Closeable) null, "disk full");
            }
            return realWriter.writeValueAsBytes(inv.getArgument(0));
        });
        ObjectMapper mapper = spy(real);
        doReturn(writer).when(mapper).writerWithDefaultPrettyPrinter();
        return mapper;
    }
}
