/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.placement.common;

import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread factory naming its threads from a format with a sequence number, for example
 * {@code "placement-worker-%d"} gives {@code placement-worker-0}, {@code placement-worker-1}, and so on.
 */
public class NamedThreadFactory implements ThreadFactory {
    private final String nameFormat;
    private final boolean daemon;
    private final AtomicLong count = new AtomicLong();

    public NamedThreadFactory(String nameFormat, boolean daemon) {
        if (nameFormat == null)
            throw new IllegalArgumentException("Name format must be non-null");
        this.nameFormat = nameFormat;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        final Thread thread = new Thread(runnable, String.format(Locale.ROOT, nameFormat, count.getAndIncrement()));
        thread.setDaemon(daemon);
        return thread;
    }
}
