package com.intervue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "pack_items")
public class PackItem {

    public static final int MIN_TIMER_SECONDS = 10;
    public static final int DEFAULT_TIMER_SECONDS = 180;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "pack_id", nullable = false)
    private Integer packId;

    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder;

    @Column(name = "timer_seconds", nullable = false)
    private Integer timerSeconds = DEFAULT_TIMER_SECONDS;
}
