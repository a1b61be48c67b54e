package com.deepansh.rag.memory;

import com.deepansh.rag.session.SessionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex heuristics that pick the user's name and age out of a message and
 * record them on the session.
 *
 * Cheap and synchronous: no LLM call. Misses are fine; a wrong guess is
 * overwritten the next time the user states it.
 */
@Component
@Slf4j
public class UserFactExtractor {

    static final String NAME_KEY = "name";
    static final String AGE_KEY = "age";

    private static final List<Pattern> NAME_PATTERNS = List.of(
            Pattern.compile("(?i)\\bmy name is\\s+([\\p{L}][\\p{L}'-]*)"),
            Pattern.compile("(?i)\\bcall me\\s+([\\p{L}][\\p{L}'-]*)"),
            Pattern.compile("(?i)\\bname's\\s+([\\p{L}][\\p{L}'-]*)"),
            Pattern.compile("저는\\s+([가-힣]+?)\\s*입니다"),
            Pattern.compile("(?:내|제)\\s*이름은\\s*([가-힣]+)")
    );

    private static final List<String> KOREAN_NAME_SUFFIXES = List.of("입니다", "이에요", "예요", "이야", "야", "요");

    private static final List<Pattern> AGE_PATTERNS = List.of(
            Pattern.compile("(\\d{1,3})\\s*살"),
            Pattern.compile("(?i)\\b(\\d{1,3})\\s*(?:years? old|yrs? old|y/o)\\b"),
            Pattern.compile("(?i)\\bi am\\s+(\\d{1,3})\\b(?!\\s*(?:%|percent|minutes?|hours?|days?))")
    );

    public void extractInto(SessionRecord session, String message) {
        if (message == null || message.isBlank()) {
            return;
        }

        extractName(message).ifPresent(name -> {
            session.setUserName(name);
            session.getFacts().put(NAME_KEY, name);
            log.info("User name extracted [sessionId={}, name={}]", session.getSessionId(), name);
        });

        extractAge(message).ifPresent(age -> {
            session.getUserInfo().put(AGE_KEY, age);
            session.getFacts().put(AGE_KEY, String.valueOf(age));
            log.debug("User age extracted [sessionId={}, age={}]", session.getSessionId(), age);
        });
    }

    Optional<String> extractName(String message) {
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                String candidate = stripKoreanSuffix(matcher.group(1).strip());
                if (candidate.length() > 1 && candidate.length() < 10) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    Optional<Integer> extractAge(String message) {
        for (Pattern pattern : AGE_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                int age = Integer.parseInt(matcher.group(1));
                if (age > 1 && age < 120) {
                    return Optional.of(age);
                }
            }
        }
        return Optional.empty();
    }

    private static String stripKoreanSuffix(String candidate) {
        for (String suffix : KOREAN_NAME_SUFFIXES) {
            if (candidate.length() > suffix.length() && candidate.endsWith(suffix)) {
                return candidate.substring(0, candidate.length() - suffix.length());
            }
        }
        return candidate;
    }
}
