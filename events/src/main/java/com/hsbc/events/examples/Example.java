package com.hsbc.events.examples;

import com.hsbc.events.Event;
import com.hsbc.events.EventHandler;
import com.hsbc.events.Signal;
import com.hsbc.events.Subscription;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Compact demonstrations of {@link Event} and {@link Signal}.
 */
public final class Example {

    private static final class PriceView {
        final String name;
        final List<String> rendered = new CopyOnWriteArrayList<>();

        PriceView(String name) {
            this.name = name;
        }

        CompletableFuture<Void> render(double price) {
            return CompletableFuture.runAsync(() -> {
                rendered.add(String.format("%.2f", price));
                System.out.println(name + " rendered " + String.format("%.2f", price));
            }, CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS));
        }
    }

    private static final class Listener {
    }

    private Example() {
        // utility class
    }

    public static void main(String[] args) throws InterruptedException {
        System.out.println("=== Event ===");
        demoEvent();

        System.out.println();
        System.out.println("=== Weak subscribers ===");
        demoWeakSubscribers();

        System.out.println();
        System.out.println("=== Signal ===");
        demoSignal();
    }

    private static void demoEvent() throws InterruptedException {
        try (Event<Double> priceChanged = new Event<>("price-changed")) {
            PriceView ticker = new PriceView("ticker");
            PriceView chart = new PriceView("chart");

            priceChanged.subscribe(ticker, PriceView::render);
            Subscription chartSubscription = priceChanged.subscribe(chart, PriceView::render);

            // fire() returns immediately, fireAndWait() drains everything fired so far
            priceChanged.fire(190.10);
            priceChanged.fire(190.15);
            priceChanged.fireAndWait(190.05);
            System.out.println("ticker saw " + ticker.rendered + ", chart saw " + chart.rendered);

            chartSubscription.unsubscribe();
            priceChanged.fireAndWait(191.00);
            System.out.println("after unsubscribe: ticker saw " + ticker.rendered.size()
                + " prices, chart saw " + chart.rendered.size());
        }
    }

    private static void demoWeakSubscribers() throws InterruptedException {
        try (Event<String> statusChanged = new Event<>("status-changed")) {
            List<String> log = new CopyOnWriteArrayList<>();

            Listener listener = new Listener();
            statusChanged.subscribe(listener, EventHandler.of(status -> log.add("listener: " + status)));
            statusChanged.fireAndWait("online");
            System.out.println("subscribers while referenced: " + statusChanged.getSubscriberCount());

            listener = null;
            for (int i = 0; i < 20 && statusChanged.getSubscriberCount() > 0; i++) {
                System.gc();
                Thread.sleep(10);
            }
            statusChanged.fireAndWait("offline");
            System.out.println("subscribers after collection: " + statusChanged.getSubscriberCount()
                + ", log: " + log);
        }
    }

    private static void demoSignal() throws InterruptedException {
        try (Signal reloaded = new Signal("reloaded")) {
            Listener cache = new Listener();
            reloaded.subscribe(cache, () -> CompletableFuture.runAsync(() ->
                System.out.println(Thread.currentThread().getName() + " invalidated cache")));

            reloaded.fire();
            reloaded.fireAndWait();
            System.out.println("signal fired " + reloaded.getTotalEventsFired() + " times");
        }
    }
}
