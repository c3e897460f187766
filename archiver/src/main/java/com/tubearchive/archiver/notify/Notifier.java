package com.tubearchive.archiver.notify;

/**
 * Outbound transport for the end-of-run summary. Implementations log their
 * own failures; a notification problem never fails a run.
 */
public interface Notifier {

    void notify(String message);

    static Notifier none() {
        return message -> { };
    }
}
