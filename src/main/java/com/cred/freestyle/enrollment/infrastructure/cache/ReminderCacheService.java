package com.cred.freestyle.enrollment.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed record of reminders already sent, so the reminder sweep
 * notifies each confirmed registration once. A claim is released when delivery
 * fails, which lets a later sweep run retry it.
 *
 * Cache Keys:
 * - reminder_sent:{registration_id} -> "1" (expires after the reminder window)
 *
 * Redis is best-effort here: when it is unavailable the reminder is sent anyway,
 * so a duplicate reminder is preferred over a missed one.
 *
 * @author Enrollment Team
 */
@Service
public class ReminderCacheService {

    private static final Logger logger = LoggerFactory.getLogger(ReminderCacheService.class);

    private static final String REMINDER_PREFIX = "reminder_sent:";
    private static final Duration REMINDER_TTL = Duration.ofDays(3);

    private final StringRedisTemplate redisTemplate;

    public ReminderCacheService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Atomically claim the reminder for a registration (SET NX with TTL).
     *
     * @param registrationId Registration ID
     * @return true if the caller should send the reminder
     */
    public boolean markReminderSent(String registrationId) {
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(REMINDER_PREFIX + registrationId, "1", REMINDER_TTL);
            if (Boolean.TRUE.equals(claimed)) {
                return true;
            }
            logger.debug("Reminder already sent for registration: {}", registrationId);
            return false;
        } catch (Exception e) {
            logger.error("Error claiming reminder in cache for registration: {}", registrationId, e);
            return true;
        }
    }

    /**
     * Release a reminder claim after a failed delivery.
     *
     * @param registrationId Registration ID
     */
    public void clearReminderSent(String registrationId) {
        try {
            redisTemplate.delete(REMINDER_PREFIX + registrationId);
            logger.info("Released reminder claim for registration: {}", registrationId);
        } catch (Exception e) {
            logger.error("Error releasing reminder claim for registration: {}", registrationId, e);
        }
    }
}
