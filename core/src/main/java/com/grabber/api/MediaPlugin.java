package com.grabber.api;

import com.grabber.core.Kernel;

public interface MediaPlugin {
    // Plugin name, e.g. "YtDlp"
    String getName();

    // Version, e.g. "1.0.0"
    String getVersion();

    // Called on startup. The plugin registers its backends here.
    void onEnable(Kernel kernel);

    // Called on shutdown (cleanup).
    void onDisable();
}
