package com.orbital.authentication;

/**
 * Registration of an {@link AuthStateListener}. Closing it stops further notifications.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();

}
