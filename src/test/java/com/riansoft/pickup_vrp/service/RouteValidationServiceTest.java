package com.riansoft.pickup_vrp.service;

import com.riansoft.pickup_vrp.exception.InvalidInputException;
import com.riansoft.pickup_vrp.model.PickupDropPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteValidationServiceTest {

    private final RouteValidationService validation = new RouteValidationService();

    private static final List<String> IDS = List.of("DEPOT", "A_P", "A_D", "B_P", "B_D");

    private static long[][] zeros(int n) {
        return new long[n][n];
    }

    private void check(List<PickupDropPair> pairs) {
        validation.validateSolveInput(IDS, zeros(5), pairs, 1, 2, 0);
    }

    @Test
    @DisplayName("정상 입력과 정원 0은 통과한다")
    void whenInputWellFormed_thenAccepted() {
        assertDoesNotThrow(() -> check(List.of(new PickupDropPair(1, 2), new PickupDropPair(3, 4))));
        assertDoesNotThrow(() -> validation.validateSolveInput(IDS, zeros(5), List.of(new PickupDropPair(1, 2)), 3, 0, 0));
        assertDoesNotThrow(() -> check(List.of()));
    }

    @Test
    @DisplayName("범위 밖, 같은 정류장, 차고지, 겹치는 쌍은 거부된다")
    void whenPairMalformed_thenRejected() {
        assertThrows(InvalidInputException.class, () -> check(List.of(new PickupDropPair(1, 5))));
        assertThrows(InvalidInputException.class, () -> check(List.of(new PickupDropPair(-1, 2))));
        assertThrows(InvalidInputException.class, () -> check(List.of(new PickupDropPair(2, 2))));
        assertThrows(InvalidInputException.class, () -> check(List.of(new PickupDropPair(0, 2))));
        assertThrows(InvalidInputException.class, () -> check(List.of(new PickupDropPair(1, 2), new PickupDropPair(2, 3))));
        assertThrows(InvalidInputException.class, () -> check(Arrays.asList(new PickupDropPair(1, 2), null)));
        assertThrows(InvalidInputException.class, () -> check(null));
    }

    @Test
    @DisplayName("행렬 크기가 맞지 않거나 음수가 있으면 거부된다")
    void whenMatrixMalformed_thenRejected() {
        long[][] ragged = zeros(5);
        ragged[3] = new long[4];
        long[][] negative = zeros(5);
        negative[1][2] = -1;

        assertThrows(InvalidInputException.class, () -> validation.validateSolveInput(IDS, zeros(4), List.of(), 1, 2, 0));
        assertThrows(InvalidInputException.class, () -> validation.validateSolveInput(IDS, ragged, List.of(), 1, 2, 0));
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> validation.validateSolveInput(IDS, negative, List.of(), 1, 2, 0));
        assertTrue(e.getMessage().contains("[1][2]"));
    }

    @Test
    @DisplayName("id 중복, 차고지 범위, 차량 수, 정원 음수를 검사한다")
    void whenFleetOrIdsMalformed_thenRejected() {
        assertThrows(InvalidInputException.class,
                () -> validation.validateSolveInput(List.of("DEPOT", "DEPOT"), zeros(2), List.of(), 1, 2, 0));
        assertThrows(InvalidInputException.class,
                () -> validation.validateSolveInput(List.of(), zeros(0), List.of(), 1, 2, 0));
        assertThrows(InvalidInputException.class, () -> validation.validateSolveInput(IDS, zeros(5), List.of(), 1, 2, 5));
        assertThrows(InvalidInputException.class, () -> validation.validateSolveInput(IDS, zeros(5), List.of(), 0, 2, 0));
        assertThrows(InvalidInputException.class, () -> validation.validateSolveInput(IDS, zeros(5), List.of(), 1, -1, 0));
    }
}
