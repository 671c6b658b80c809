package club.ppmc.girasol.exception;

/**
 * 守护进程对外报告的错误类别。
 */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    SERIALIZATION,
    STORAGE_IO,
    PROCESS_SPAWN,
    PROCESS_EXIT,
    TRANSPORT
}
