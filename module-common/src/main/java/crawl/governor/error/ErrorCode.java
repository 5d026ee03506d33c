package crawl.governor.error;

public interface ErrorCode {
  String getCode();

  String getMessage();

  ErrorKind getKind();
}
