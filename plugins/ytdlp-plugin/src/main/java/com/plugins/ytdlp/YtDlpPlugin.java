package com.plugins.ytdlp;

import com.grabber.api.DownloadBackend;
import com.grabber.api.MediaPlugin;
import com.grabber.core.Kernel;
import com.grabber.core.config.Configuration;
import com.grabber.core.strategy.StrategyTable;
import com.plugins.ytdlp.internal.FfmpegStreamBackend;
import com.plugins.ytdlp.internal.GalleryDlBackend;
import com.plugins.ytdlp.internal.YtDlpBackend;
import com.plugins.ytdlp.internal.YtDlpProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * YtDlp Plugin - registers the backends that drive external downloaders:
 * yt-dlp (three profiles), ffmpeg stream copy and gallery-dl.
 * <p>
 * Tool locations can be overridden in {@code pluginConfigs.YtDlp}:
 * {@code yt_dlp_path}, {@code ffmpeg_path}, {@code gallery_dl_path}.
 */
public class YtDlpPlugin implements MediaPlugin {
    private static final Logger logger = LoggerFactory.getLogger(YtDlpPlugin.class);

    static final String NAME = "YtDlp";

    private Kernel kernel;
    private final List<String> registered = new ArrayList<>();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        Configuration config = kernel.getConfigManager().getConfig();

        String ytDlp = config.getPluginSetting(NAME, "yt_dlp_path", "yt-dlp");
        String ffmpeg = config.getPluginSetting(NAME, "ffmpeg_path", "ffmpeg");
        String galleryDl = config.getPluginSetting(NAME, "gallery_dl_path", "gallery-dl");

        var locator = kernel.getToolLocator();
        var runner = kernel.getProcessRunner();

        register(new YtDlpBackend(StrategyTable.YT_DLP, YtDlpProfile.STANDARD, locator, runner, ytDlp));
        register(new YtDlpBackend(StrategyTable.YT_DLP_TUNED, YtDlpProfile.TUNED, locator, runner, ytDlp));
        register(new YtDlpBackend(StrategyTable.YT_DLP_GENERIC, YtDlpProfile.GENERIC, locator, runner, ytDlp));
        register(new FfmpegStreamBackend(locator, runner, ffmpeg, ytDlp));
        register(new GalleryDlBackend(locator, runner, galleryDl));

        if (locator.locate(ytDlp).isEmpty()) {
            logger.warn("⚠️ yt-dlp not found (tools/ or PATH). yt-dlp backends will be skipped.");
        }
        logger.info("✅ YtDlp Plugin enabled ({} backends)", registered.size());
    }

    private void register(DownloadBackend backend) {
        kernel.getBackendRegistry().register(backend);
        registered.add(backend.getName());
    }

    @Override
    public void onDisable() {
        if (kernel != null) {
            registered.forEach(kernel.getBackendRegistry()::unregister);
        }
        registered.clear();
        logger.info("YtDlp Plugin disabled");
    }
}
