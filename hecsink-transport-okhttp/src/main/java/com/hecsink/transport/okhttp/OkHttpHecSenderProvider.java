package com.hecsink.transport.okhttp;

import com.hecsink.transport.HecSender;
import com.hecsink.transport.HecSenderProvider;
import com.hecsink.transport.HecTransportSettings;

/** Registered in {@code META-INF/services}; picked up by {@link com.hecsink.transport.HecSenders}. */
public class OkHttpHecSenderProvider implements HecSenderProvider {

    @Override
    public String name() {
        return "okhttp";
    }

    @Override
    public HecSender create(HecTransportSettings settings) {
        return new OkHttpHecSender(settings);
    }
}
