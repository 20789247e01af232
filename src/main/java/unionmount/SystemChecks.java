package unionmount;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

/**
 * Does some very basic checks against system/OS limits.
 *
 * Currently this is just hardcoded with a "you'll probably need at least 10,000" value,
 * instead of gauging how many directories the mounted sources actually have. The user can
 * opt-out with a CLI flag.
 */
public class SystemChecks {

  private static final Logger log = LoggerFactory.getLogger(SystemChecks.class);
  private static final File maxUserWatchesFile = new File("/proc/sys/fs/inotify/max_user_watches");
  static final int minimumWatches = 10_000;

  /**
   * @return true if the system passes our best-guess capacity checks
   */
  public static boolean checkLimits() {
    return checkMaxUserWatches(maxUserWatchesFile);
  }

  @VisibleForTesting
  static boolean checkMaxUserWatches(File file) {
    // only exists on linux, which is all we need to check
    if (!file.exists()) {
      return true;
    }
    int maxUserWatches;
    try {
      maxUserWatches = Integer.parseInt(StringUtils.trim(FileUtils.readFileToString(file, UTF_8)));
    } catch (IOException | NumberFormatException e) {
      log.info("Could not read {}, skipping check: {}", file, e.getMessage());
      return true;
    }
    if (maxUserWatches < minimumWatches) {
      log.error("Your max_user_watches is {} and should probably be increased (each directory == 1 watch)", maxUserWatches);
      log.info("  See https://github.com/guard/listen/wiki/Increasing-the-amount-of-inotify-watchers");
      log.info("  E.g. run: echo fs.inotify.max_user_watches=524288 | sudo tee -a /etc/sysctl.conf && sudo sysctl -p");
      log.info("  Or use --skip-limit-checks to ignore this");
      return false;
    }
    return true;
  }

}
