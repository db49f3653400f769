package com.jreinhal.docqa.support;

/**
 * Retrieved-context fixtures taken from a course completion certificate and a mark sheet.
 */
public final class Contexts {

    public static final String CERTIFICATE = "Jan-Mar 2025 (8 week course) Design and analysis of algorithms "
            + "RADADIYA HETVI HASMUKHBHAI 22/25 35.63/75 58 1696 NPTEL25CS23S334600098 "
            + "Roll No: No. of credits recommended: 2 or 3 To verify the certificate visit nptel.ac.in/noc";

    public static final String CERTIFICATE_FIELDS = "Assignment Score: 22/25  Exam Score: 35.63/75  Total Score: 58  "
            + "Course: Design and Analysis of Algorithms  Duration: Jan-Mar 2025";

    public static final String MARK_SHEET = "Subject: Mathematics  Marks: 87/100  Grade: A  "
            + "Subject: Physics  Marks: 72/100  Grade: B  Aggregate percentage: 79.5%  "
            + "Student: John Doe  Roll: 2023001";

    private Contexts() {
    }
}
