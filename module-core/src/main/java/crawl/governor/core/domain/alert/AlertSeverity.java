package crawl.governor.core.domain.alert;

/** Alert severity. FATAL marks a persistent CRITICAL run condition. */
public enum AlertSeverity {
  WARNING,
  CRITICAL,
  FATAL
}
