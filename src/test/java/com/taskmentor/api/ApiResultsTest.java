package com.taskmentor.api;

import com.taskmentor.tracker.ErrorKind;
import com.taskmentor.tracker.OperationResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.*;

class ApiResultsTest {

    @Test
    void testEveryErrorKindHasStatus() {
        assertArrayEquals(new ErrorKind[]{ErrorKind.VALIDATION, ErrorKind.NOT_FOUND, ErrorKind.PERSISTENCE},
                ErrorKind.values());
        assertEquals(HttpStatus.BAD_REQUEST, ApiResults.statusOf(ErrorKind.VALIDATION));
        assertEquals(HttpStatus.NOT_FOUND, ApiResults.statusOf(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ApiResults.statusOf(ErrorKind.PERSISTENCE));
    }

    @Test
    void testUnwrapThrowsWithMessage() {
        assertEquals("ok", ApiResults.unwrap(OperationResult.success("ok")));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ApiResults.unwrap(OperationResult.failure(ErrorKind.NOT_FOUND, "Task not found")));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertEquals("Task not found", ex.getReason());
    }
}
