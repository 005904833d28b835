package alpha.emitter.examples;

import alpha.emitter.DefaultEventHub;
import alpha.emitter.EventHub;
import alpha.emitter.Listener;
import alpha.emitter.Symbol;

/**
 * Registers, emits and removes a few listeners, printing what happens on
 * {@code System.out}.
 */
public final class BasicUsage
{
    private BasicUsage() {
        // Empty
    }

    /**
     * Application's entry point.
     *
     * @param args ignored
     */
    public static void main(String... args) {
        EventHub hub = new DefaultEventHub();

        hub.on("message", (ctx, a) -> System.out.println("Received message: " + a[0]));
        hub.emit("message", "Hello, World!");

        // A once-listener is removed before it runs, the second emission
        // finds no listener and returns false.
        hub.once("welcome", (ctx, a) -> System.out.println("Welcome " + a[0] + "!"));
        hub.emit("welcome", "Alice");
        System.out.println("Bob welcomed: " + hub.emit("welcome", "Bob"));

        // Removal is based on reference identity, so keep the reference
        Listener goodbye = (ctx, a) -> System.out.println("Goodbye " + a[0] + "!");
        hub.on("goodbye", goodbye);
        hub.emit("goodbye", "Charlie");
        hub.off("goodbye", goodbye);
        hub.emit("goodbye", "David");

        // Any number of arguments
        hub.on("sum", (ctx, a) -> {
            int sum = 0;
            for (Object o : a) {
                sum += (Integer) o;
            }
            System.out.println("Sum: " + sum);
        });
        hub.emit("sum", 1, 2, 3, 4, 5, 6);

        // The context is the hub, unless another one is given
        Object counter = new StringBuilder("counter");
        hub.on("context", (ctx, a) -> System.out.println("Context is hub: " + (ctx == hub)));
        hub.on("context", (ctx, a) -> System.out.println("Context: " + ctx), counter);
        hub.emit("context");

        // A symbol is equal only to itself
        Symbol secret = Symbol.of("secret");
        hub.on(secret, (ctx, a) -> System.out.println("Secret event received"));
        hub.emit(secret);
        System.out.println("Text \"secret\" has listeners: " + hub.emit("secret"));

        System.out.println("Event names: " + hub.eventNames());
        System.out.println("Listeners of \"context\": " + hub.listenerCount("context"));

        hub.removeAllListeners();
        System.out.println("Event names after removeAllListeners(): " + hub.eventNames());
    }
}
