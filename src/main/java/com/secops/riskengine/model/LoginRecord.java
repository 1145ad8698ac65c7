package com.secops.riskengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

@Value
@Builder
public class LoginRecord {
    Instant datetime;
    LocalDate date;
    DayOfWeek dayOfWeek;
    int hourOfDay;
    boolean weekend;
    String sourceIp;
    String loginGeoId;

    public static LoginRecord of(Instant datetime, String sourceIp, String loginGeoId, ZoneId zone) {
        ZonedDateTime local = datetime.atZone(zone);
        DayOfWeek day = local.getDayOfWeek();
        return LoginRecord.builder()
                .datetime(datetime)
                .date(local.toLocalDate())
                .dayOfWeek(day)
                .hourOfDay(local.getHour())
                .weekend(day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)
                .sourceIp(sourceIp)
                .loginGeoId(loginGeoId)
                .build();
    }
}
