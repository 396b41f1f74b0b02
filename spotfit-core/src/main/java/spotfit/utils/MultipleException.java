/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of SPOTFIT
 *
 * SPOTFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SPOTFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SPOTFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package spotfit.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * Errors collected while running several independent units of work (e.g. fitting tasks).
 * Each error is stored with the identifier of the unit that produced it.
 * @author Jean Ollion
 */
public class MultipleException extends RuntimeException {
    final private List<Pair<String, Throwable>> exceptions; // key: source of the exception (task, spot range ...)
    public MultipleException(List<Pair<String, Throwable>> exceptions) {
        this.exceptions= new ArrayList<>();
        addExceptions(exceptions);
        if (!this.exceptions.isEmpty()) initCause(this.exceptions.get(0).value);
    }
    public MultipleException() {
        this.exceptions=new ArrayList<>();
    }

    public void addExceptions(Collection<Pair<String, Throwable>> ex) {
        ex.forEach(this::addException);
    }

    /**
     * Identical errors (same message and same stack trace) thrown by different sources are merged, sources are concatenated with ";"
     * The pair is copied: {@code ex} is not modified.
     */
    public void addException(Pair<String, Throwable> ex) {
        if (ex==null || ex.value==null || ex.key==null) return;
        for (Pair<String, Throwable> p : exceptions) {
            if (throwableEqual.test(p.value, ex.value)) {
                p.key+=";"+ex.key;
                return;
            }
        }
        exceptions.add(new Pair<>(ex.key, ex.value));
    }

    private final static BiPredicate<Throwable, Throwable> tEq = (t1, t2) -> {
       if (t1==null) return t2==null;
       if (t2==null) return false;
       if (t1.getMessage()==null ? t2.getMessage()!=null : !t1.getMessage().equals(t2.getMessage())) return false;
       return Arrays.equals(t1.getStackTrace(), t2.getStackTrace());
    };
    public final static BiPredicate<Throwable, Throwable> throwableEqual = (t1, t2) -> tEq.test(t1, t2) && tEq.test(t1.getCause(), t2.getCause());

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }

    @Override
    public String getMessage() {
        return exceptions.size()+" error(s): "+exceptions.stream().map(p -> p.key+": "+p.value).collect(Collectors.joining(", "));
    }
}
