package dev.jobboard.web;

import dev.jobboard.exception.ValidationException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Helpers shared by the controllers.
 */
final class Requests {

    private Requests() {
    }

    /**
     * Run a blocking service call off the event loop.
     */
    static <T> Mono<T> call(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    static Mono<Void> run(Runnable call) {
        return Mono.fromRunnable(call).subscribeOn(Schedulers.boundedElastic()).then();
    }

    /**
     * Parse an optional enum request parameter with the enum's own lenient parser.
     *
     * @return null when the parameter is absent or blank
     */
    static <E extends Enum<E>> E parseEnum(String raw, Function<String, E> parser, String name) {
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + name + ": " + raw);
        }
    }
}
