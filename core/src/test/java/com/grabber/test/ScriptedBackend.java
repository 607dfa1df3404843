package com.grabber.test;

import com.grabber.api.DownloadBackend;
import com.grabber.api.DownloadOutcome;
import com.grabber.api.FetchRequest;
import com.grabber.api.TransferListener;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Backend double: replays queued outcomes and records every request it receives.
 * Once the script is used up the last outcome (or {@code fallback}) repeats.
 */
public class ScriptedBackend implements DownloadBackend {

    private final String name;
    private final Deque<DownloadOutcome> script = new ArrayDeque<>();
    private final List<FetchRequest> requests = new ArrayList<>();
    private final Map<String, DownloadOutcome> perUrl = new HashMap<>();
    private DownloadOutcome fallback;
    private Consumer<FetchRequest> onFetch = r -> {
    };

    public ScriptedBackend(String name) {
        this.name = name;
        this.fallback = DownloadOutcome.failure("no script", Duration.ZERO);
    }

    public static ScriptedBackend alwaysSucceeds(String name) {
        return new ScriptedBackend(name).otherwise(DownloadOutcome.success("ok", Duration.ZERO));
    }

    public static ScriptedBackend alwaysFails(String name, String error) {
        return new ScriptedBackend(name).otherwise(DownloadOutcome.failure(error, Duration.ZERO));
    }

    public ScriptedBackend then(DownloadOutcome outcome) {
        script.addLast(outcome);
        return this;
    }

    public ScriptedBackend thenFail(String error) {
        return then(DownloadOutcome.failure(error, Duration.ZERO));
    }

    public ScriptedBackend thenSucceed() {
        return then(DownloadOutcome.success("ok", Duration.ZERO));
    }

    public ScriptedBackend otherwise(DownloadOutcome outcome) {
        this.fallback = outcome;
        return this;
    }

    /**
     * Fixed outcome for one URL, checked before the script.
     */
    public ScriptedBackend forUrl(String url, DownloadOutcome outcome) {
        perUrl.put(url, outcome);
        return this;
    }

    public ScriptedBackend onFetch(Consumer<FetchRequest> hook) {
        this.onFetch = hook;
        return this;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DownloadOutcome fetch(FetchRequest request, TransferListener listener) {
        requests.add(request);
        onFetch.accept(request);
        if (perUrl.containsKey(request.url())) return perUrl.get(request.url());
        return script.isEmpty() ? fallback : script.pollFirst();
    }

    public List<FetchRequest> getRequests() {
        return requests;
    }

    public int invocations() {
        return requests.size();
    }

    public long invocationsFor(String url) {
        return requests.stream().filter(r -> r.url().equals(url)).count();
    }
}
