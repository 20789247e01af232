package unionmount;

/** Why a file that still exists is being reported. */
public enum RefreshAction {

  /** No recent change, just notifying of the file's existence, e.g. during the initial scan. */
  EXISTING,

  /** A new file got created. */
  NEW,

  /** The already existing file was updated. */
  UPDATE;

}
