package org.coursesched.normalizers;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Outcome<T> {
    private final T value;
    private final String skipReason;

    public static <T> Outcome<T> produced(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> skipped(String reason) {
        return new Outcome<>(null, reason);
    }

    public boolean isProduced() {
        return skipReason == null;
    }
}
