package in.dhanstream.infrastructure.stream.decoder;

import in.dhanstream.domain.feed.DecodedEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one inbound message: exactly one of {@code event} or {@code error} is set.
 *
 * @param event     decoded event, null on failure
 * @param error     failure reason, null on success
 * @param rawLength size of the input that was decoded
 */
public record DecodeResult(DecodedEvent event, String error, int rawLength) {

    public static DecodeResult success(DecodedEvent event, int rawLength) {
        return new DecodeResult(Objects.requireNonNull(event, "event"), null, rawLength);
    }

    public static DecodeResult failure(String error, int rawLength) {
        return new DecodeResult(null, Objects.requireNonNull(error, "error"), rawLength);
    }

    public boolean isSuccess() {
        return event != null;
    }

    public Optional<DecodedEvent> eventOptional() {
        return Optional.ofNullable(event);
    }
}
