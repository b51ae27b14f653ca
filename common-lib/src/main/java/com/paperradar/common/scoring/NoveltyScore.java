package com.paperradar.common.scoring;

/** @param discounted true when the value came from keywords alone or from no evidence */
public record NoveltyScore(double value, boolean discounted) {}
