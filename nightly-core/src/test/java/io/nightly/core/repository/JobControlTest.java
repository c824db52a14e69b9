package io.nightly.core.repository;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import io.nightly.core.schedule.BackupScheduler;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.nightly.core.JobFixtures.definition;
import static java.time.ZoneOffset.UTC;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@RunWith(MockitoJUnitRunner.class)
public class JobControlTest
{
    @Mock BackupScheduler scheduler;

    private MemoryJobStore store;
    private JobControl control;

    @Before
    public void setUp()
    {
        store = new MemoryJobStore();
        control = new JobControl(store, scheduler,
                Clock.fixed(Instant.parse("2024-01-10T01:00:00Z"), UTC));
    }

    private ModelValidationException assertInvalid(JobDefinition def)
    {
        try {
            control.addJob(def);
        }
        catch (ModelValidationException ex) {
            assertThat(store.getJobs(), is(empty()));
            verifyNoInteractions(scheduler);
            return ex;
        }
        fail("ModelValidationException expected");
        return null;
    }

    @Test
    public void addAssignsIdStoresAndSchedules()
    {
        Job job = control.addJob(definition(Cadence.DAILY, 2, 0).build());

        assertThat(job.getId(), startsWith("job_"));
        assertThat(job.getId().matches("job_[0-9a-f]{13}\\.[0-9]{8}"), is(true));
        assertThat(store.getJobs(), contains(job));
        verify(scheduler).schedule(job);
    }

    @Test
    public void rejectsBlankTitle()
    {
        ModelValidationException ex = assertInvalid(definition(Cadence.DAILY, 2, 0).title("  ").build());
        assertThat(ex.getFailures().get(0).getFieldName(), is("title"));
    }

    @Test
    public void rejectsWeeklyWithoutWeekday()
    {
        ModelValidationException ex = assertInvalid(definition(Cadence.WEEKLY, 2, 0).build());
        assertThat(ex.getFailures().get(0).getFieldName(), is("weekday"));
    }

    @Test
    public void rejectsMonthlyDayOutOfRange()
    {
        ModelValidationException ex = assertInvalid(definition(Cadence.MONTHLY, 2, 0).dayOfMonth(32).build());
        assertThat(ex.getFailures().get(0).getFieldName(), is("day_of_month"));
        assertThat(ex.getMessage(), containsString("must be between 1 and 31"));

        assertInvalid(definition(Cadence.MONTHLY, 2, 0).build());
    }

    @Test
    public void rejectsEmailStorageWithoutValidAddress()
    {
        assertInvalid(definition(Cadence.DAILY, 2, 0).storage(StorageMode.EMAIL).build());
        ModelValidationException ex = assertInvalid(definition(Cadence.DAILY, 2, 0)
                .storage(StorageMode.EMAIL)
                .email("not-an-address")
                .build());
        assertThat(ex.getFailures().get(0).getFieldName(), is("email"));
    }

    @Test
    public void acceptsEmailStorageWithAddress()
    {
        Job job = control.addJob(definition(Cadence.WEEKLY, 2, 0)
                .weekday(DayOfWeek.FRIDAY)
                .storage(StorageMode.EMAIL)
                .email("dba@example.com")
                .build());
        assertThat(job.getEmail().get(), is("dba@example.com"));
    }

    @Test
    public void updateReplacesInPlaceAndReschedules()
        throws Exception
    {
        Job first = control.addJob(definition(Cadence.DAILY, 1, 0).title("first").build());
        Job second = control.addJob(definition(Cadence.DAILY, 2, 0).title("second").build());

        Job updated = control.updateJob(first.getId(),
                definition(Cadence.MONTHLY, 4, 0).title("first").dayOfMonth(1).build());

        assertThat(updated.getId(), is(first.getId()));
        assertThat(updated.getCadence(), is(Cadence.MONTHLY));
        assertThat(store.getJobs().stream().map(Job::getId).collect(Collectors.toList()),
                contains(first.getId(), second.getId()));

        InOrder order = inOrder(scheduler);
        order.verify(scheduler).unschedule(first.getId());
        order.verify(scheduler).schedule(updated);
    }

    @Test
    public void updateOfUnknownJobFails()
    {
        try {
            control.updateJob("job_missing", definition(Cadence.DAILY, 1, 0).build());
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), containsString("job_missing"));
        }
        verify(scheduler, never()).schedule(any(Job.class));
        assertThat(store.getJobs(), is(empty()));
    }

    @Test
    public void deleteUnschedulesAndRemoves()
        throws Exception
    {
        Job job = control.addJob(definition(Cadence.DAILY, 1, 0).build());

        Job deleted = control.deleteJob(job.getId());

        assertThat(deleted, is(job));
        assertThat(store.getJobs(), is(empty()));
        verify(scheduler, times(2)).unschedule(job.getId());
    }

    @Test
    public void deleteUnschedulesAgainAfterStoreRemoval()
        throws Exception
    {
        Job job = control.addJob(definition(Cadence.DAILY, 1, 0).build());
        List<Boolean> storedAtUnschedule = new ArrayList<>();
        doAnswer(invocation -> storedAtUnschedule.add(!store.getJobs().isEmpty()))
            .when(scheduler).unschedule(job.getId());

        control.deleteJob(job.getId());

        assertThat(storedAtUnschedule, contains(true, false));
    }

    @Test(expected = ResourceNotFoundException.class)
    public void deleteOfUnknownJobFails()
        throws Exception
    {
        control.deleteJob("job_missing");
    }

    @Test(expected = ResourceNotFoundException.class)
    public void getOfUnknownJobFails()
        throws Exception
    {
        control.getJob("job_missing");
    }
}
