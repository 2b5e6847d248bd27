package io.chrono4j;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class JsonJobHandlerTest {

    public static class Greeting {
        public String to;
        public int times;
    }

    private static class GreetingHandler extends JsonJobHandler<Greeting> {
        Greeting seen;

        @Override
        public String name() {
            return "greet";
        }

        @Override
        public Class<Greeting> dataClass() {
            return Greeting.class;
        }

        @Override
        protected Object handle(JobContext context, Greeting data) {
            seen = data;
            if (data == null) {
                return null;
            }
            return Map.of("message", "hello " + data.to, "times", data.times);
        }
    }

    private final JobContext context = mock(JobContext.class);

    @Test
    void payloadShouldBeDecodedAndResultEncoded() throws Exception {
        GreetingHandler handler = new GreetingHandler();
        String out = handler.execute(context, "{\"to\":\"bob\",\"times\":2}");

        assertEquals("bob", handler.seen.to);
        assertEquals(2, handler.seen.times);
        assertEquals(Map.of("message", "hello bob", "times", 2),
                new ObjectMapper().readValue(out, Map.class));
    }

    @Test
    void blankPayloadShouldBeNullAndNullResultEmpty() throws Exception {
        GreetingHandler handler = new GreetingHandler();
        assertEquals("", handler.execute(context, "  "));
        assertNull(handler.seen);
    }

    @Test
    void stringResultShouldBeReturnedAsIs() throws Exception {
        JsonJobHandler<Greeting> handler = new JsonJobHandler<>() {
            @Override
            public String name() {
                return "plain";
            }

            @Override
            public Class<Greeting> dataClass() {
                return Greeting.class;
            }

            @Override
            protected Object handle(JobContext ctx, Greeting data) {
                return "done at " + Instant.EPOCH;
            }
        };
        assertEquals("done at 1970-01-01T00:00:00Z", handler.execute(context, null));
    }

    @Test
    void malformedPayloadShouldFail() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new GreetingHandler().execute(context, "{not json"));
        assertInstanceOf(JsonProcessingException.class, ex.getCause());
    }
}
