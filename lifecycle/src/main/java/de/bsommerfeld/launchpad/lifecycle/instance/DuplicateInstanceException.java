package de.bsommerfeld.launchpad.lifecycle.instance;

public class DuplicateInstanceException extends RuntimeException {

    public DuplicateInstanceException(String instanceId) {
        super("Instance already registered: " + instanceId);
    }
}
