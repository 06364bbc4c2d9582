package org.fpbjs.amlmapper.fpb.models;

public record Point(double x, double y) {
}
