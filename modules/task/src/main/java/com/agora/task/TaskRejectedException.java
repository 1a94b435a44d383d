package com.agora.task;

/**
 * 작업 관리자가 중지되어 새 작업을 받을 수 없을 때 발생합니다.
 *
 * @author Agora
 * @version 1.0
 */
public class TaskRejectedException extends RuntimeException {

    public TaskRejectedException(String taskName) {
        super("작업 관리자가 중지되어 작업을 받을 수 없습니다: " + taskName);
    }
}
