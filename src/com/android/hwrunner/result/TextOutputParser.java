/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.android.hwrunner.result;

import com.android.hwrunner.result.SentinelMatch.Sentinel;

import com.google.common.annotations.VisibleForTesting;

import java.util.List;

/**
 * Splits the captured stdout or stderr of a job between its subtests and dynamic subtests by
 * locating the sentinel lines the test binary printed.
 *
 * <p>The output of a job is partitioned: a subtest owns the text from the line after the previous
 * subtest's result line up to and including its own result line. The last subtest also owns any
 * trailing text. A subtest that started but never reported a result owns everything up to the
 * next subtest sentinel. Dynamic subtests partition the span of their parent the same way.
 */
public class TextOutputParser {

    private final String mBinary;
    private final RunResults mResults;

    public TextOutputParser(String binary, RunResults results) {
        mBinary = binary;
        mResults = results;
    }

    /**
     * Distributes {@code output} to the nodes of {@code subtests}. Text after a NUL character is
     * ignored. Results are only taken from the output for nodes that have none yet.
     */
    public void parse(String output, OutputKind kind, SubtestList subtests) {
        int nul = output.indexOf('\0');
        String buf = nul >= 0 ? output.substring(0, nul) : output;
        int bufEnd = buf.length();
        String igtVersion = findIgtVersion(buf);

        if (subtests.isEmpty()) {
            TestResultNode node = mResults.getOrCreateTest(TestNames.of(mBinary, null));
            node.setOutput(kind, buf);
            node.setIgtVersion(igtVersion);
            return;
        }

        List<SentinelMatch> matches = SentinelMatch.findAll(buf, 0, bufEnd);
        for (Subtest subtest : subtests.getSubtests()) {
            String name = TestNames.of(mBinary, subtest.getName());
            TestResultNode node = mResults.getOrCreateTest(name);

            int beginIdx =
                    findIndex(
                            matches,
                            buf,
                            bufEnd,
                            Sentinel.STARTING_SUBTEST,
                            subtest.getName(),
                            0,
                            matches.size());
            int resultIdx =
                    findIndex(
                            matches,
                            buf,
                            bufEnd,
                            Sentinel.SUBTEST_RESULT,
                            subtest.getName(),
                            0,
                            matches.size());
            int beg = beginLimit(matches, buf, beginIdx, resultIdx, 0, bufEnd, 0, false);
            int end =
                    endLimit(matches, buf, beginIdx, resultIdx, bufEnd, 0, matches.size(), false);

            node.setOutput(kind, buf.substring(beg, end));
            node.setIgtVersion(igtVersion);

            if (!node.hasResult()) {
                ParsedResult parsed =
                        parseResultLine(
                                subtest.getName(),
                                OutputStrings.SUBTEST_RESULT,
                                buf,
                                resultIdx < 0 ? -1 : matches.get(resultIdx).getWhere(),
                                end);
                node.setResult(parsed.mStatus);
                node.setRuntime(parsed.mTime);
            }

            if (beginIdx >= 0 || resultIdx >= 0) {
                processDynamicSubtests(
                        name, subtest, igtVersion, matches, buf, beginIdx, resultIdx, beg, end,
                        kind);
            }
        }
    }

    private void processDynamicSubtests(
            String parentName,
            Subtest subtest,
            String igtVersion,
            List<SentinelMatch> matches,
            String buf,
            int beginIdx,
            int resultIdx,
            int beg,
            int end,
            OutputKind kind) {
        if (resultIdx < 0) {
            // An incomplete parent ends at the next subtest start or result.
            for (resultIdx = beginIdx + 1; resultIdx < matches.size(); resultIdx++) {
                if (!matches.get(resultIdx).getWhat().isDynamic()) {
                    break;
                }
            }
        }

        for (int k = beginIdx + 1; k < resultIdx; k++) {
            SentinelMatch match = matches.get(k);
            if (match.getWhat() != Sentinel.STARTING_DYNAMIC_SUBTEST) {
                continue;
            }
            int nameStart =
                    match.getWhere() + Sentinel.STARTING_DYNAMIC_SUBTEST.getPrefix().length();
            String dynamicName = firstToken(buf, nameStart, end);
            if (dynamicName.isEmpty()) {
                continue;
            }

            int dynResultIdx =
                    findIndex(
                            matches,
                            buf,
                            end,
                            Sentinel.DYNAMIC_SUBTEST_RESULT,
                            dynamicName,
                            k,
                            resultIdx);
            int dynBeg = beginLimit(matches, buf, k, dynResultIdx, beg, end, beginIdx + 1, true);
            int dynEnd =
                    endLimit(matches, buf, k, dynResultIdx, end, beginIdx + 1, resultIdx, true);

            subtest.addDynamicSubtest(dynamicName);
            TestResultNode node =
                    mResults.getOrCreateTest(TestNames.dynamic(parentName, dynamicName));
            node.setOutput(kind, buf.substring(dynBeg, dynEnd));
            node.setIgtVersion(igtVersion);

            if (!node.hasResult()) {
                ParsedResult parsed =
                        parseResultLine(
                                dynamicName,
                                OutputStrings.DYNAMIC_SUBTEST_RESULT,
                                buf,
                                dynResultIdx < 0 ? -1 : matches.get(dynResultIdx).getWhere(),
                                dynEnd);
                TestStatus status = parsed.mStatus;
                // An incomplete dynamic subtest inherits the abnormal end of its parent.
                if (status == TestStatus.INCOMPLETE) {
                    TestResultNode parent = mResults.getTest(parentName);
                    if (parent != null
                            && (parent.getResult() == TestStatus.ABORT
                                    || parent.getResult() == TestStatus.NOTRUN)) {
                        status = parent.getResult();
                    }
                }
                node.setResult(status);
                node.setRuntime(parsed.mTime);
            }
        }
    }

    /**
     * Index of the first match in [first, last) of the given kind for {@code name}: start lines
     * must be exactly {@code prefix + name + "\n"}, result lines start with {@code prefix + name +
     * ": "}. Returns -1 when there is none.
     */
    @VisibleForTesting
    static int findIndex(
            List<SentinelMatch> matches,
            String buf,
            int bufEnd,
            Sentinel kind,
            String name,
            int first,
            int last) {
        String fullLine =
                kind.isResult() ? kind.getPrefix() + name + ": " : kind.getPrefix() + name + "\n";
        for (int k = first; k < last; k++) {
            SentinelMatch match = matches.get(k);
            if (match.getWhat() != kind) {
                continue;
            }
            int len = Math.min(fullLine.length(), bufEnd - match.getWhere());
            if (len >= 0 && buf.regionMatches(match.getWhere(), fullLine, 0, len)) {
                return k;
            }
        }
        return -1;
    }

    /** Start offset of the span of a (dynamic) subtest. */
    private static int beginLimit(
            List<SentinelMatch> matches,
            String buf,
            int beginIdx,
            int resultIdx,
            int bufStart,
            int bufEnd,
            int first,
            boolean dynamic) {
        if (beginIdx < 0 && resultIdx < 0) {
            return bufStart;
        }
        int anchor = beginIdx >= 0 ? beginIdx : resultIdx;
        for (int k = anchor - 1; k >= first; k--) {
            SentinelMatch previous = matches.get(k);
            if (previous.getWhat().isDynamic() != dynamic) {
                continue;
            }
            if (previous.getWhat().isResult()) {
                int next = SentinelMatch.nextLine(buf, previous.getWhere(), bufEnd);
                return next < 0 ? bufEnd : next;
            }
            // The previous one never reported a result and owns everything up to our line.
            return matches.get(anchor).getWhere();
        }
        return bufStart;
    }

    /** End offset (exclusive) of the span of a (dynamic) subtest. */
    private static int endLimit(
            List<SentinelMatch> matches,
            String buf,
            int beginIdx,
            int resultIdx,
            int bufEnd,
            int first,
            int last,
            boolean dynamic) {
        if (beginIdx < first && resultIdx < first) {
            return bufEnd;
        }
        if (resultIdx < first) {
            for (int k = beginIdx + 1; k < last; k++) {
                if (matches.get(k).getWhat().isDynamic() == dynamic) {
                    return matches.get(k).getWhere();
                }
            }
            return bufEnd;
        }
        if (resultIdx < last - 1) {
            int next = SentinelMatch.nextLine(buf, matches.get(resultIdx).getWhere(), bufEnd);
            return next < 0 ? bufEnd : next;
        }
        return bufEnd;
    }

    /** Status and runtime read from a result line. */
    static final class ParsedResult {
        final TestStatus mStatus;
        final double mTime;

        ParsedResult(TestStatus status, double time) {
            mStatus = status;
            mTime = time;
        }
    }

    /**
     * Parses a line of the form {@code <prefix><name>: <RESULT> (<seconds>s)}. A missing or
     * foreign line gives an incomplete result.
     */
    @VisibleForTesting
    static ParsedResult parseResultLine(
            String name, String prefix, String buf, int line, int bufEnd) {
        if (line < 0) {
            return new ParsedResult(TestStatus.INCOMPLETE, 0.0);
        }
        int lineEnd = buf.indexOf('\n', line);
        if (lineEnd < 0 || lineEnd > bufEnd) {
            lineEnd = bufEnd;
        }
        int resultStart = line + prefix.length() + name.length() + 2;
        if (resultStart > lineEnd || !buf.startsWith(name, line + prefix.length())) {
            return new ParsedResult(TestStatus.INCOMPLETE, 0.0);
        }
        return parseResultString(buf.substring(resultStart, lineEnd));
    }

    /** Parses {@code <RESULT> (<seconds>s)}; the runtime part is optional. */
    static ParsedResult parseResultString(String text) {
        int wordEnd = 0;
        while (wordEnd < text.length() && !Character.isWhitespace(text.charAt(wordEnd))) {
            wordEnd++;
        }
        TestStatus status = TestStatus.fromResultWord(text.substring(0, wordEnd));
        double time = 0.0;
        int paren = wordEnd + 1;
        if (paren < text.length() && text.charAt(paren) == '(') {
            time = JournalParser.parseLeadingDouble(text.substring(paren + 1));
        }
        return new ParsedResult(status, time);
    }

    /** Returns the {@code IGT-Version: } line without its newline, or null. */
    @VisibleForTesting
    static String findIgtVersion(String buf) {
        int line = 0;
        while (line >= 0 && line < buf.length()) {
            if (buf.startsWith(OutputStrings.IGT_VERSIONSTRING, line)) {
                int newline = buf.indexOf('\n', line);
                return buf.substring(line, newline < 0 ? buf.length() : newline);
            }
            int newline = buf.indexOf('\n', line);
            line = newline < 0 ? -1 : newline + 1;
        }
        return null;
    }

    private static String firstToken(String buf, int pos, int end) {
        while (pos < end && Character.isWhitespace(buf.charAt(pos))) {
            pos++;
        }
        int start = pos;
        while (pos < end && !Character.isWhitespace(buf.charAt(pos))) {
            pos++;
        }
        return buf.substring(start, pos);
    }
}
